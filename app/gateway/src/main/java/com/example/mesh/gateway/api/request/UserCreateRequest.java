package com.example.mesh.gateway.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserCreateRequest(@NotBlank String name, @NotBlank String email) {}
