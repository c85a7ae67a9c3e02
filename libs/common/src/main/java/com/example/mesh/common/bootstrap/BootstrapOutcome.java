/*
 * どこで: Common 起動シーケンス
 * 何を: 起動処理の終端結果 (致命的失敗 / 外部停止) を表現する
 * なぜ: プロセス終了の判断をトップレベルの呼び出し元一箇所に集約するため
 */
package com.example.mesh.common.bootstrap;

public record BootstrapOutcome(Kind kind, BootstrapState failedAt, Throwable cause) {

  public enum Kind {
    FATAL,
    STOPPED
  }

  public static BootstrapOutcome fatal(BootstrapState failedAt, Throwable cause) {
    return new BootstrapOutcome(Kind.FATAL, failedAt, cause);
  }

  public static BootstrapOutcome stopped() {
    return new BootstrapOutcome(Kind.STOPPED, null, null);
  }

  public boolean isFatal() {
    return kind == Kind.FATAL;
  }
}
