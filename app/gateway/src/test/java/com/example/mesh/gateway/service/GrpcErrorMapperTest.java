package com.example.mesh.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.grpc.Status;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GrpcErrorMapperTest {

  @ParameterizedTest
  @CsvSource({
    "INVALID_ARGUMENT, INVALID_ARGUMENT",
    "OUT_OF_RANGE, INVALID_ARGUMENT",
    "NOT_FOUND, NOT_FOUND",
    "ALREADY_EXISTS, CONFLICT",
    "UNAVAILABLE, UNAVAILABLE",
    "DEADLINE_EXCEEDED, TIMEOUT",
    "INTERNAL, BAD_GATEWAY",
    "UNKNOWN, BAD_GATEWAY",
    "PERMISSION_DENIED, BAD_GATEWAY"
  })
  void mapsStatusCodeToReason(Status.Code code, ServiceIntegrationException.Reason expected) {
    final ServiceIntegrationException mapped =
        GrpcErrorMapper.map(
            "users-service", Status.fromCode(code).withDescription("detail").asRuntimeException());

    assertThat(mapped.reason()).isEqualTo(expected);
    assertThat(mapped.service()).isEqualTo("users-service");
    assertThat(mapped.getMessage()).isEqualTo("detail");
  }

  @Test
  void fallsBackToCodeNameWithoutDescription() {
    final ServiceIntegrationException mapped =
        GrpcErrorMapper.map("products-service", Status.UNAVAILABLE.asRuntimeException());

    assertThat(mapped.getMessage()).isEqualTo("UNAVAILABLE");
    assertThat(mapped.getCause()).isNotNull();
  }
}
