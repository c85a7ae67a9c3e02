/*
 * どこで: Common 起動シーケンス
 * 何を: 依存先接続の試行結果と現在の起動状態をメトリクスとして記録する
 * なぜ: 起動が詰まっているサービスを監視から特定できるようにするため
 */
package com.example.mesh.common.bootstrap;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BootstrapMetrics {

  private static final String METRIC_CONNECT_ATTEMPTS = "mesh.bootstrap.connect.attempts";
  private static final String METRIC_STATE = "mesh.bootstrap.state";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger state = new AtomicInteger(BootstrapState.INIT.ordinal());
  private final ConcurrentMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();

  public BootstrapMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_STATE, state, AtomicInteger::get)
        .description("Current bootstrap state ordinal")
        .register(meterRegistry);
  }

  public void recordConnectAttempt(String dependency, String result) {
    final String key = dependency + "|" + result;
    attemptCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CONNECT_ATTEMPTS)
                    .description("Dependency connection attempts during bootstrap")
                    .tags(Tags.of("dependency", dependency, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateState(BootstrapState current) {
    state.set(current.ordinal());
  }
}
