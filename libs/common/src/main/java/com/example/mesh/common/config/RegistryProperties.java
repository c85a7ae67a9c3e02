/*
 * どこで: Common 設定バインド
 * 何を: Consul agent の接続先と health check 設定を保持する
 * なぜ: CONSUL_HTTP_ADDR による上書きとチェック間隔の調整を可能にするため
 */
package com.example.mesh.common.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mesh.registry")
public record RegistryProperties(
    String address,
    String token,
    Duration checkInterval,
    Duration deregisterCriticalAfter,
    Duration timeout) {

  static final String DEFAULT_ADDRESS = "127.0.0.1:8500";

  public RegistryProperties {
    address = address == null || address.isBlank() ? DEFAULT_ADDRESS : address.trim();
    token = token == null ? "" : token;
    checkInterval = checkInterval == null ? Duration.ofSeconds(10) : checkInterval;
    deregisterCriticalAfter =
        deregisterCriticalAfter == null ? Duration.ofSeconds(30) : deregisterCriticalAfter;
    timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
  }

  public String baseUrl() {
    if (address.startsWith("http://") || address.startsWith("https://")) {
      return address;
    }
    return "http://" + address;
  }
}
