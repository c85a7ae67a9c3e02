package com.example.mesh.products.model;

import java.time.Instant;

public record ProductRecord(
    long id, String name, double price, Instant createdAt, Instant updatedAt) {}
