package com.example.mesh.gateway.api;

import com.example.mesh.gateway.service.GatewayMetrics;
import com.example.mesh.gateway.service.ServiceIntegrationException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(ServiceIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleServiceIntegration(
      ServiceIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case INVALID_ARGUMENT -> "INVALID_ARGUMENT";
          case NOT_FOUND -> "NOT_FOUND";
          case CONFLICT -> "CONFLICT";
          case UNAVAILABLE -> "SERVICE_UNAVAILABLE";
          case TIMEOUT -> "UPSTREAM_TIMEOUT";
          case BAD_GATEWAY -> "BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case CONFLICT -> HttpStatus.CONFLICT;
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
        };
    gatewayMetrics.recordDownstreamError(ex.service(), code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("request body is invalid");
    return ResponseEntity.badRequest().body(new ApiErrorResponse("INVALID_REQUEST", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse("INVALID_REQUEST", "request body is not valid JSON"));
  }
}
