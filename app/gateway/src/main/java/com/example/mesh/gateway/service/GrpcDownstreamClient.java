/*
 * どこで: Gateway サービス層
 * 何を: 発見 → チャネル取得 → deadline 付き呼び出し → Status 変換を共通化する
 * なぜ: users / products の各クライアントで失敗時の扱いを揃えるため
 */
package com.example.mesh.gateway.service;

import io.grpc.Channel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class GrpcDownstreamClient {

  private static final Logger logger = LoggerFactory.getLogger(GrpcDownstreamClient.class);

  private final ConsulServiceResolver resolver;
  private final GrpcChannelPool channelPool;
  private final GatewayMetrics metrics;
  private final String serviceName;

  GrpcDownstreamClient(
      ConsulServiceResolver resolver,
      GrpcChannelPool channelPool,
      GatewayMetrics metrics,
      String serviceName) {
    this.resolver = resolver;
    this.channelPool = channelPool;
    this.metrics = metrics;
    this.serviceName = serviceName;
  }

  protected <T> T call(String method, Function<Channel, T> invocation) {
    final ServiceInstance instance = resolver.resolve(serviceName);
    final long startedAt = System.nanoTime();
    try {
      final T result = invocation.apply(channelPool.channel(instance));
      record(method, "OK", startedAt);
      return result;
    } catch (StatusRuntimeException ex) {
      final Status.Code code = ex.getStatus().getCode();
      record(method, code.name(), startedAt);
      if (code == Status.Code.UNAVAILABLE) {
        channelPool.evict(instance);
      }
      logger.warn(
          "downstream call failed service={} method={} target={} code={} description={}",
          serviceName,
          method,
          instance.target(),
          code,
          ex.getStatus().getDescription());
      throw GrpcErrorMapper.map(serviceName, ex);
    }
  }

  protected String serviceName() {
    return serviceName;
  }

  private void record(String method, String result, long startedAt) {
    metrics.recordDownstreamDuration(
        serviceName, method, result, Duration.ofNanos(System.nanoTime() - startedAt));
  }
}
