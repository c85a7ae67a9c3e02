/*
 * どこで: Gateway サービス層
 * 何を: 下流呼び出しの所要時間とエラー種別をメトリクスとして記録する
 * なぜ: どの下流サービスがどの理由で失敗しているかを Prometheus から観測するため
 */
package com.example.mesh.gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  private static final String METRIC_DOWNSTREAM_ERROR_TOTAL = "gateway.downstream.error.total";
  private static final String METRIC_DOWNSTREAM_DURATION = "gateway.downstream.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> durationTimers = new ConcurrentHashMap<>();

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDownstreamError(String service, String code) {
    final String key = service + "|" + code;
    errorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DOWNSTREAM_ERROR_TOTAL)
                    .description("Gateway downstream errors by service and code")
                    .tags(Tags.of("service", service, "code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDownstreamDuration(
      String service, String method, String result, Duration duration) {
    final String key = service + "|" + method + "|" + result;
    durationTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_DOWNSTREAM_DURATION)
                    .description("Gateway downstream gRPC call duration")
                    .tags(Tags.of("service", service, "method", method, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
