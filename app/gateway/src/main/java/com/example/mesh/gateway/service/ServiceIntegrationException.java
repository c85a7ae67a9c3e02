/*
 * どこで: Gateway サービス層
 * 何を: 下流サービスの発見・呼び出し失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.mesh.gateway.service;

public class ServiceIntegrationException extends RuntimeException {

  public enum Reason {
    INVALID_ARGUMENT,
    NOT_FOUND,
    CONFLICT,
    UNAVAILABLE,
    TIMEOUT,
    BAD_GATEWAY
  }

  private final Reason reason;
  private final String service;

  public ServiceIntegrationException(Reason reason, String service, String message) {
    super(message);
    this.reason = reason;
    this.service = service;
  }

  public ServiceIntegrationException(
      Reason reason, String service, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.service = service;
  }

  public Reason reason() {
    return reason;
  }

  public String service() {
    return service;
  }
}
