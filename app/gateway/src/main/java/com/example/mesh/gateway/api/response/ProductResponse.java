package com.example.mesh.gateway.api.response;

public record ProductResponse(String id, String name, double price) {}
