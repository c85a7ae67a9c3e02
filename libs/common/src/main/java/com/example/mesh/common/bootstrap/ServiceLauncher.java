/*
 * どこで: Common 起動シーケンス
 * 何を: Spring コンテキストを起動し、起動シーケンスの結果に応じて終了コードを決める
 * なぜ: プロセス終了 (System.exit) を行うのはこのクラスだけにするため
 */
package com.example.mesh.common.bootstrap;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

public final class ServiceLauncher {

  private static final Logger logger = LoggerFactory.getLogger(ServiceLauncher.class);
  static final int EXIT_OK = 0;
  static final int EXIT_FATAL = 1;

  private ServiceLauncher() {}

  public static void launch(Class<?> application, String[] args) {
    final ConfigurableApplicationContext context = SpringApplication.run(application, args);
    final int exitCode = serve(context.getBean(BootstrapOrchestrator.class));
    if (exitCode != EXIT_OK) {
      System.exit(SpringApplication.exit(context, () -> exitCode));
    }
  }

  @VisibleForTesting
  static int serve(BootstrapOrchestrator orchestrator) {
    final BootstrapOutcome outcome = orchestrator.run();
    return exitCodeFor(outcome);
  }

  @VisibleForTesting
  static int exitCodeFor(BootstrapOutcome outcome) {
    if (outcome.isFatal()) {
      logger.error(
          "fatal startup failure state={} cause={}",
          outcome.failedAt(),
          outcome.cause() == null ? "unknown" : outcome.cause().toString());
      return EXIT_FATAL;
    }
    logger.info("service stopped");
    return EXIT_OK;
  }
}
