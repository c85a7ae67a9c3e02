/*
 * どこで: Common 設定バインド
 * 何を: 起動シーケンスの待機時間・DB 接続リトライ・スキーマ同期設定を保持する
 * なぜ: 依存先の起動待ち方針を環境ごとに外部化するため
 */
package com.example.mesh.common.config;

import com.example.mesh.common.bootstrap.RetryPolicy;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mesh.bootstrap")
public record BootstrapProperties(
    Duration settleDelay,
    Database database,
    Schema schema,
    Duration startupTimeout,
    Duration shutdownGrace) {

  public BootstrapProperties {
    settleDelay = settleDelay == null ? Duration.ofSeconds(10) : settleDelay;
    database = database == null ? new Database(0, null, null, null, 0.0d, null) : database;
    schema = schema == null ? new Schema(null, null, null) : schema;
    shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
  }

  public record Database(
      int maxAttempts,
      Duration retryDelay,
      RetryPolicy.Backoff backoff,
      Duration maxDelay,
      double jitterRatio,
      Duration validationTimeout) {

    public Database {
      maxAttempts = maxAttempts <= 0 ? 30 : maxAttempts;
      retryDelay = retryDelay == null ? Duration.ofSeconds(10) : retryDelay;
      backoff = backoff == null ? RetryPolicy.Backoff.FIXED : backoff;
      maxDelay = maxDelay == null ? Duration.ofMinutes(1) : maxDelay;
      validationTimeout = validationTimeout == null ? Duration.ofSeconds(5) : validationTimeout;
    }

    public RetryPolicy retryPolicy() {
      return new RetryPolicy(maxAttempts, retryDelay, backoff, maxDelay, jitterRatio);
    }
  }

  public record Schema(String name, List<String> locations, String historyTable) {

    public Schema {
      name = name == null || name.isBlank() ? "public" : name;
      locations =
          locations == null || locations.isEmpty() ? List.of("classpath:db/migration") : locations;
      historyTable =
          historyTable == null || historyTable.isBlank() ? "flyway_schema_history" : historyTable;
    }
  }
}
