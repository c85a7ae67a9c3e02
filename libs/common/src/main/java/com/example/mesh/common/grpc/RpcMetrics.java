/*
 * どこで: Common gRPC 基盤
 * 何を: RPC ごとの呼び出し結果と処理時間をメトリクスとして記録する
 * なぜ: サービス間で同じメトリクス名・タグで成功率を監視できるようにするため
 */
package com.example.mesh.common.grpc;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RpcMetrics {

  private static final String METRIC_CALLS = "mesh.rpc.server.calls";
  private static final String METRIC_DURATION = "mesh.rpc.server.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> callCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> durationTimers = new ConcurrentHashMap<>();

  public RpcMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCall(String method, String status, Duration duration) {
    final String key = method + "|" + status;
    callCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CALLS)
                    .description("gRPC server calls by method and status code")
                    .tags(Tags.of("method", method, "status", status))
                    .register(meterRegistry))
        .increment();
    durationTimers
        .computeIfAbsent(
            method,
            ignored ->
                Timer.builder(METRIC_DURATION)
                    .description("gRPC server call duration")
                    .tags(Tags.of("method", method))
                    .register(meterRegistry))
        .record(duration);
  }
}
