/*
 * どこで: Common 起動シーケンス
 * 何を: 依存先接続の試行回数と待機時間の計算方法を保持する
 * なぜ: 固定間隔と上限付き指数バックオフを同じ「回数超過で致命的」契約で切り替えるため
 */
package com.example.mesh.common.bootstrap;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(
    int maxAttempts, Duration delay, Backoff backoff, Duration maxDelay, double jitterRatio) {

  public enum Backoff {
    FIXED,
    EXPONENTIAL
  }

  private static final int MAX_EXPONENT = 30;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    if (delay == null || delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    backoff = backoff == null ? Backoff.FIXED : backoff;
    maxDelay = maxDelay == null || maxDelay.compareTo(delay) < 0 ? delay : maxDelay;
    if (jitterRatio < 0.0d || jitterRatio >= 1.0d) {
      throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
    }
  }

  public static RetryPolicy fixed(int maxAttempts, Duration delay) {
    return new RetryPolicy(maxAttempts, delay, Backoff.FIXED, delay, 0.0d);
  }

  /** Delay to wait after the given 1-based attempt has failed. */
  public Duration delayAfter(int failedAttempt) {
    if (backoff == Backoff.FIXED) {
      return delay;
    }
    final int exponent = Math.min(Math.max(failedAttempt - 1, 0), MAX_EXPONENT);
    final double exp = delay.toMillis() * Math.pow(2.0d, exponent);
    final double capped = Math.min(exp, maxDelay.toMillis());
    final double jitter =
        1.0d - jitterRatio + ThreadLocalRandom.current().nextDouble() * (2.0d * jitterRatio);
    final long millis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
  }
}
