package com.example.mesh.gateway.api.response;

public record HealthResponse(String status) {}
