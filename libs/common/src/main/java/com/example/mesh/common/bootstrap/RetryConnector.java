/*
 * どこで: Common 起動シーケンス
 * 何を: 依存先への接続を上限回数まで試行し、成功したハンドルを返す
 * なぜ: 依存先のコールドスタート中にプロセスを落とさず、上限到達時のみ致命的失敗にするため
 */
package com.example.mesh.common.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryConnector {

  private static final Logger logger = LoggerFactory.getLogger(RetryConnector.class);

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final BootstrapMetrics metrics;

  public RetryConnector(RetryPolicy policy, Sleeper sleeper, BootstrapMetrics metrics) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.metrics = metrics;
  }

  public <T> T connect(String dependency, ConnectionAttempt<T> connectionAttempt)
      throws InterruptedException {
    Exception lastFailure = null;
    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      try {
        final T handle = connectionAttempt.attempt();
        metrics.recordConnectAttempt(dependency, "success");
        logger.info(
            "dependency connected dependency={} attempt={}/{}",
            dependency,
            attempt,
            policy.maxAttempts());
        return handle;
      } catch (InterruptedException ex) {
        throw ex;
      } catch (Exception ex) {
        lastFailure = ex;
        metrics.recordConnectAttempt(dependency, "failure");
        logger.warn(
            "failed to connect dependency={} attempt={}/{} cause={}",
            dependency,
            attempt,
            policy.maxAttempts(),
            ex.toString());
      }
      // 最終試行の後は待たずに致命的失敗へ進む
      if (attempt < policy.maxAttempts()) {
        sleeper.sleep(policy.delayAfter(attempt));
      }
    }
    throw new RetryExhaustedException(dependency, policy.maxAttempts(), lastFailure);
  }

  public RetryPolicy policy() {
    return policy;
  }
}
