/*
 * どこで: Common 起動シーケンス
 * 何を: DB 接続 → スキーマ同期 → gRPC bind → health SERVING → Consul 登録 → serve を順に実行する
 * なぜ: どのサービスも同じ前進のみの状態遷移で起動し、失敗時は FATAL の結果だけを返すため
 */
package com.example.mesh.common.bootstrap;

import com.example.mesh.common.config.BootstrapProperties;
import com.example.mesh.common.grpc.BoundListener;
import com.example.mesh.common.grpc.GrpcListener;
import com.example.mesh.common.grpc.HealthReporter;
import com.example.mesh.common.registry.HealthCheckDescriptor;
import com.example.mesh.common.registry.RegistryRegistrant;
import com.example.mesh.common.registry.ServiceIdentity;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.BindableService;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings one service from process start to steady-state serving.
 *
 * <p>{@link #run()} is strictly sequential and blocks the calling thread: the fixed settle delay,
 * every retry backoff and finally the serve loop are its suspension points. Any failure is
 * returned as {@link BootstrapOutcome#fatal}. A listener that was already bound is shut down and
 * reported NOT_SERVING; the database pool is left to the application context.
 */
public class BootstrapOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(BootstrapOrchestrator.class);
  private static final String DATABASE = "database";

  private final BootstrapProperties properties;
  private final Sleeper sleeper;
  private final RetryConnector retryConnector;
  private final DatabaseConnector databaseConnector;
  private final SchemaSynchronizer schemaSynchronizer;
  private final GrpcListener grpcListener;
  private final HealthReporter healthReporter;
  private final RegistryRegistrant registrant;
  private final ServiceIdentity identity;
  private final HealthCheckDescriptor healthCheck;
  private final List<BindableService> services;
  private final BootstrapMetrics metrics;

  private final AtomicReference<BootstrapState> state =
      new AtomicReference<>(BootstrapState.INIT);
  private final AtomicReference<BoundListener> boundListener = new AtomicReference<>();
  private final Object cancelLock = new Object();
  private Thread bootstrapThread;
  private boolean cancelRequested;
  private boolean registrationCommitted;
  private volatile boolean stopping;

  public BootstrapOrchestrator(
      BootstrapProperties properties,
      Sleeper sleeper,
      RetryConnector retryConnector,
      DatabaseConnector databaseConnector,
      SchemaSynchronizer schemaSynchronizer,
      GrpcListener grpcListener,
      HealthReporter healthReporter,
      RegistryRegistrant registrant,
      ServiceIdentity identity,
      HealthCheckDescriptor healthCheck,
      List<BindableService> services,
      BootstrapMetrics metrics) {
    this.properties = properties;
    this.sleeper = sleeper;
    this.retryConnector = retryConnector;
    this.databaseConnector = databaseConnector;
    this.schemaSynchronizer = schemaSynchronizer;
    this.grpcListener = grpcListener;
    this.healthReporter = healthReporter;
    this.registrant = registrant;
    this.identity = identity;
    this.healthCheck = healthCheck;
    this.services = List.copyOf(services);
    this.metrics = metrics;
  }

  public BootstrapOutcome run() {
    if (state.get() != BootstrapState.INIT) {
      throw new IllegalStateException("bootstrap already ran state=" + state.get());
    }
    synchronized (cancelLock) {
      bootstrapThread = Thread.currentThread();
    }
    final ScheduledExecutorService deadline = scheduleStartupDeadline();
    try {
      return runSequence(deadline);
    } finally {
      if (deadline != null) {
        deadline.shutdownNow();
      }
      synchronized (cancelLock) {
        bootstrapThread = null;
      }
    }
  }

  private BootstrapOutcome runSequence(ScheduledExecutorService deadline) {
    try {
      // 依存 DB 自身のコールドスタートを待つ
      sleeper.sleep(properties.settleDelay());
      transition(BootstrapState.DB_CONNECTING);
      final DataSource dataSource = retryConnector.connect(DATABASE, databaseConnector);
      transition(BootstrapState.DB_READY);
      schemaSynchronizer.synchronize(dataSource);

      final BoundListener listener = grpcListener.bind(services, healthReporter);
      boundListener.set(listener);
      transition(BootstrapState.LISTENER_BOUND);
      // 物理的に受け付け可能になった時点で SERVING にする (レジストリ登録より前)
      healthReporter.markServing();

      // bind は割り込みを見ないため、登録前にキャンセル済みかを確認する
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("cancelled before registration");
      }
      registrant.register(identity, healthCheck);
      commitRegistration();
      transition(BootstrapState.REGISTERED);
      if (deadline != null) {
        deadline.shutdownNow();
      }

      transition(BootstrapState.SERVING);
      logger.info(
          "{} gRPC server listening address={} port={}",
          identity.name(),
          identity.address(),
          listener.port());
      listener.awaitTermination();
      logger.info("{} gRPC server terminated", identity.name());
      return BootstrapOutcome.stopped();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      if (state.get() == BootstrapState.SERVING && stopping) {
        return BootstrapOutcome.stopped();
      }
      return fail(new IllegalStateException("bootstrap interrupted", ex));
    } catch (IOException | RuntimeException ex) {
      return fail(ex);
    }
  }

  /**
   * Interrupts a bootstrap whose registration has not completed yet.
   *
   * <p>Once the registry accepted the service the request is ignored, so a cancel racing a
   * successful registration never turns a served startup into {@link BootstrapState#FATAL}.
   */
  public void cancel() {
    synchronized (cancelLock) {
      if (bootstrapThread == null || registrationCommitted || cancelRequested) {
        return;
      }
      cancelRequested = true;
      logger.warn("bootstrap cancelled state={}", state.get());
      bootstrapThread.interrupt();
    }
  }

  @PreDestroy
  public void stop() {
    stopping = true;
    healthReporter.enterTerminalState();
    final BoundListener listener = boundListener.get();
    if (listener != null) {
      listener.shutdown(properties.shutdownGrace());
    }
  }

  public BootstrapState state() {
    return state.get();
  }

  private void commitRegistration() {
    synchronized (cancelLock) {
      registrationCommitted = true;
      // 登録中 (割り込み不可の HTTP 呼び出し) に届いたキャンセルは完了した登録を優先して捨てる
      if (cancelRequested && Thread.interrupted()) {
        logger.warn(
            "cancel arrived during registration; keeping the completed registration service={}",
            identity.name());
      }
    }
  }

  private BootstrapOutcome fail(Throwable cause) {
    final BootstrapState failedAt = state.get();
    transition(BootstrapState.FATAL);
    logger.error("bootstrap failed state={} service={}", failedAt, identity.name(), cause);
    final BoundListener listener = boundListener.get();
    if (listener != null) {
      healthReporter.markNotServing();
      listener.shutdown(properties.shutdownGrace());
    }
    return BootstrapOutcome.fatal(failedAt, cause);
  }

  private void transition(BootstrapState next) {
    final BootstrapState previous = state.getAndSet(next);
    metrics.updateState(next);
    logger.info("bootstrap transition from={} to={}", previous, next);
  }

  private ScheduledExecutorService scheduleStartupDeadline() {
    final Duration timeout = properties.startupTimeout();
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return null;
    }
    final ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("bootstrap-deadline-%d")
                .setDaemon(true)
                .build());
    executor.schedule(this::cancel, timeout.toMillis(), TimeUnit.MILLISECONDS);
    return executor;
  }
}
