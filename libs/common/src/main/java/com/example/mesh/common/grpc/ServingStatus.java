package com.example.mesh.common.grpc;

import io.grpc.health.v1.HealthCheckResponse;

public enum ServingStatus {
  SERVING,
  NOT_SERVING;

  HealthCheckResponse.ServingStatus toProto() {
    return this == SERVING
        ? HealthCheckResponse.ServingStatus.SERVING
        : HealthCheckResponse.ServingStatus.NOT_SERVING;
  }
}
