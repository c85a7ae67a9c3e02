package com.example.mesh.gateway.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ProductCreateRequest(@NotBlank String name, @NotNull @PositiveOrZero Double price) {}
