/*
 * どこで: Common 起動シーケンス
 * 何を: 起動ステートマシンの状態を定義する
 * なぜ: 前進のみの遷移と唯一の吸収状態 FATAL を型で表現するため
 */
package com.example.mesh.common.bootstrap;

public enum BootstrapState {
  INIT,
  DB_CONNECTING,
  DB_READY,
  LISTENER_BOUND,
  REGISTERED,
  SERVING,
  FATAL
}
