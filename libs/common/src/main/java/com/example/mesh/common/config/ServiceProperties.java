/*
 * どこで: Common 設定バインド
 * 何を: サービスの論理名・広告アドレス・gRPC ポートを保持する
 * なぜ: 起動後に変化しないサービス識別子を一箇所で確定させるため
 */
package com.example.mesh.common.config;

import com.example.mesh.common.registry.ServiceIdentity;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mesh.service")
public record ServiceProperties(
    @NotBlank String name, String address, @Min(1) @Max(65535) int port) {

  public ServiceProperties {
    // Docker ネットワーク内ではサービス名がそのままホスト名になる
    address = address == null || address.isBlank() ? name : address;
  }

  public ServiceIdentity identity() {
    return new ServiceIdentity(name, address, port);
  }
}
