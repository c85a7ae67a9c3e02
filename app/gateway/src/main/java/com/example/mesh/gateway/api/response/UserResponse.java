package com.example.mesh.gateway.api.response;

public record UserResponse(String id, String name, String email) {}
