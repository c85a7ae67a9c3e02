/*
 * どこで: Common サービス登録
 * 何を: レジストリに依頼する能動ヘルスチェックの内容を保持する
 * なぜ: チェック間隔と critical 継続時の自動登録解除をレジストリ側へ委ねるため
 */
package com.example.mesh.common.registry;

import java.time.Duration;

public record HealthCheckDescriptor(
    Protocol protocol, String target, Duration interval, Duration deregisterCriticalAfter) {

  public enum Protocol {
    GRPC
  }

  public static HealthCheckDescriptor grpc(
      ServiceIdentity identity, Duration interval, Duration deregisterCriticalAfter) {
    return new HealthCheckDescriptor(
        Protocol.GRPC, identity.target(), interval, deregisterCriticalAfter);
  }
}
