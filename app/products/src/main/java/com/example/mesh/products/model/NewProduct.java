package com.example.mesh.products.model;

public record NewProduct(String name, double price) {}
