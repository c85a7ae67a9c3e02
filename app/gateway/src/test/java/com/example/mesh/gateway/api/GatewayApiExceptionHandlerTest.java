package com.example.mesh.gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.mesh.gateway.service.GatewayMetrics;
import com.example.mesh.gateway.service.ServiceIntegrationException;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class GatewayApiExceptionHandlerTest {

  @Mock private GatewayMetrics gatewayMetrics;
  @InjectMocks private GatewayApiExceptionHandler handler;

  @ParameterizedTest
  @CsvSource({
    "INVALID_ARGUMENT, 400, INVALID_ARGUMENT",
    "NOT_FOUND, 404, NOT_FOUND",
    "CONFLICT, 409, CONFLICT",
    "UNAVAILABLE, 503, SERVICE_UNAVAILABLE",
    "TIMEOUT, 504, UPSTREAM_TIMEOUT",
    "BAD_GATEWAY, 502, BAD_GATEWAY"
  })
  void mapsReasonToStatusAndCode(
      ServiceIntegrationException.Reason reason, int expectedStatus, String expectedCode) {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleServiceIntegration(
            new ServiceIntegrationException(reason, "products-service", "detail"));

    assertThat(response.getStatusCode().value()).isEqualTo(expectedStatus);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse(expectedCode, "detail"));
    verify(gatewayMetrics).recordDownstreamError("products-service", expectedCode);
  }
}
