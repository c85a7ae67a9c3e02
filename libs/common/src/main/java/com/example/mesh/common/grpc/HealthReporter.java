/*
 * どこで: Common gRPC 基盤
 * 何を: 標準 grpc.health.v1 サービスへ SERVING/NOT_SERVING を反映する
 * なぜ: Consul の gRPC health check と呼び出し側が同じ状態を観測するため
 */
package com.example.mesh.common.grpc;

import io.grpc.BindableService;
import io.grpc.protobuf.services.HealthStatusManager;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide health flag exposed through the gRPC health service.
 *
 * <p>The status starts as {@link ServingStatus#NOT_SERVING} for the whole server and for every
 * tracked service. Only the bootstrap sequence flips it; {@link #status()} is the read side.
 */
public class HealthReporter {

  private static final Logger logger = LoggerFactory.getLogger(HealthReporter.class);

  private final HealthStatusManager statusManager = new HealthStatusManager();
  private final AtomicReference<ServingStatus> status =
      new AtomicReference<>(ServingStatus.NOT_SERVING);
  private final Set<String> trackedServices = ConcurrentHashMap.newKeySet();
  private volatile boolean terminal;

  public HealthReporter() {
    // HealthStatusManager は全体ステータス "" を SERVING で初期化するため明示的に落とす
    statusManager.setStatus(
        HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.NOT_SERVING.toProto());
  }

  public BindableService healthService() {
    return statusManager.getHealthService();
  }

  public void track(String serviceName) {
    trackedServices.add(serviceName);
    statusManager.setStatus(serviceName, status.get().toProto());
  }

  public ServingStatus status() {
    return status.get();
  }

  public Set<String> trackedServices() {
    return Set.copyOf(trackedServices);
  }

  public void markServing() {
    apply(ServingStatus.SERVING);
  }

  public void markNotServing() {
    apply(ServingStatus.NOT_SERVING);
  }

  public void enterTerminalState() {
    terminal = true;
    status.set(ServingStatus.NOT_SERVING);
    statusManager.enterTerminalState();
    logger.info("health status entered terminal state");
  }

  private void apply(ServingStatus next) {
    if (terminal) {
      return;
    }
    final ServingStatus previous = status.getAndSet(next);
    statusManager.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES, next.toProto());
    for (String serviceName : trackedServices) {
      statusManager.setStatus(serviceName, next.toProto());
    }
    if (previous != next) {
      logger.info(
          "health status changed from={} to={} services={}", previous, next, trackedServices);
    }
  }
}
