package com.example.mesh.gateway.service;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

final class GrpcErrorMapper {
  private GrpcErrorMapper() {}

  static ServiceIntegrationException map(String service, StatusRuntimeException ex) {
    final Status status = ex.getStatus();
    final String description =
        status.getDescription() == null ? status.getCode().name() : status.getDescription();
    final ServiceIntegrationException.Reason reason =
        switch (status.getCode()) {
          case INVALID_ARGUMENT, OUT_OF_RANGE ->
              ServiceIntegrationException.Reason.INVALID_ARGUMENT;
          case NOT_FOUND -> ServiceIntegrationException.Reason.NOT_FOUND;
          case ALREADY_EXISTS -> ServiceIntegrationException.Reason.CONFLICT;
          case UNAVAILABLE -> ServiceIntegrationException.Reason.UNAVAILABLE;
          case DEADLINE_EXCEEDED -> ServiceIntegrationException.Reason.TIMEOUT;
          default -> ServiceIntegrationException.Reason.BAD_GATEWAY;
        };
    return new ServiceIntegrationException(reason, service, description, ex);
  }
}
