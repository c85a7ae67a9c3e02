/*
 * どこで: Common サービス登録
 * 何を: Consul agent の service register API へ送る JSON を定義する
 * なぜ: Consul のフィールド名 (PascalCase) と Go の duration 表記に合わせるため
 */
package com.example.mesh.common.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsulServiceRegistration(
    @JsonProperty("ID") String id,
    @JsonProperty("Name") String name,
    @JsonProperty("Address") String address,
    @JsonProperty("Port") int port,
    @JsonProperty("Check") Check check) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Check(
      @JsonProperty("GRPC") String grpc,
      @JsonProperty("Interval") String interval,
      @JsonProperty("DeregisterCriticalServiceAfter") String deregisterCriticalServiceAfter) {}

  public static ConsulServiceRegistration of(
      ServiceIdentity identity, HealthCheckDescriptor healthCheck) {
    final Check check =
        switch (healthCheck.protocol()) {
          case GRPC -> new Check(
              healthCheck.target(),
              toGoDuration(healthCheck.interval()),
              toGoDuration(healthCheck.deregisterCriticalAfter()));
        };
    return new ConsulServiceRegistration(
        identity.name(), identity.name(), identity.address(), identity.port(), check);
  }

  static String toGoDuration(Duration duration) {
    if (duration.toMillisPart() == 0) {
      return duration.toSeconds() + "s";
    }
    return duration.toMillis() + "ms";
  }
}
