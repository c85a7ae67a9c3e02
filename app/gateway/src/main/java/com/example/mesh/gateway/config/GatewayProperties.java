/*
 * どこで: Gateway 設定
 * 何を: 下流サービスの論理名と gRPC 呼び出しの deadline を保持する
 * なぜ: Consul に登録された名前と呼び出しタイムアウトを外部化するため
 */
package com.example.mesh.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mesh.gateway")
public record GatewayProperties(
    String usersService, String productsService, Duration callDeadline) {

  public GatewayProperties {
    usersService = usersService == null || usersService.isBlank() ? "users-service" : usersService;
    productsService =
        productsService == null || productsService.isBlank() ? "products-service" : productsService;
    callDeadline = callDeadline == null ? Duration.ofSeconds(5) : callDeadline;
  }
}
