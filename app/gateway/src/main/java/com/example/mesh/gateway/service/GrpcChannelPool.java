/*
 * どこで: Gateway サービス層
 * 何を: 解決済みの host:port ごとに ManagedChannel を 1 本だけ保持する
 * なぜ: リクエストごとの接続確立を避け、終了時にまとめて閉じるため
 */
package com.example.mesh.gateway.service;

import io.grpc.ClientInterceptor;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GrpcChannelPool implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(GrpcChannelPool.class);
  private static final long CLOSE_TIMEOUT_SECONDS = 5;

  private final Function<ServiceInstance, ManagedChannel> channelFactory;
  private final ConcurrentMap<String, ManagedChannel> channels = new ConcurrentHashMap<>();

  public GrpcChannelPool(Function<ServiceInstance, ManagedChannel> channelFactory) {
    this.channelFactory = channelFactory;
  }

  public static GrpcChannelPool plaintext(ClientInterceptor... interceptors) {
    return new GrpcChannelPool(
        instance ->
            Grpc.newChannelBuilderForAddress(
                    instance.host(), instance.port(), InsecureChannelCredentials.create())
                .intercept(interceptors)
                .build());
  }

  public ManagedChannel channel(ServiceInstance instance) {
    return channels.computeIfAbsent(
        instance.target(),
        target -> {
          logger.info("opening grpc channel service={} target={}", instance.service(), target);
          return channelFactory.apply(instance);
        });
  }

  /** Drops the channel of an instance that stopped answering so the next call reconnects. */
  public void evict(ServiceInstance instance) {
    final ManagedChannel channel = channels.remove(instance.target());
    if (channel != null) {
      logger.info(
          "evicting grpc channel service={} target={}", instance.service(), instance.target());
      channel.shutdown();
    }
  }

  public int size() {
    return channels.size();
  }

  @Override
  public void close() {
    channels.values().forEach(ManagedChannel::shutdown);
    for (ManagedChannel channel : channels.values()) {
      try {
        if (!channel.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          channel.shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        channel.shutdownNow();
      }
    }
    channels.clear();
  }
}
