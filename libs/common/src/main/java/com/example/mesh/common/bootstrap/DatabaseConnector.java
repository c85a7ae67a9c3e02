/*
 * どこで: Common 起動シーケンス
 * 何を: プールから接続を 1 本借りて検証し、DataSource をハンドルとして返す
 * なぜ: Hikari の遅延初期化を起動シーケンスの明示的な接続確認に置き換えるため
 */
package com.example.mesh.common.bootstrap;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;

public class DatabaseConnector implements ConnectionAttempt<DataSource> {

  private final DataSource dataSource;
  private final Duration validationTimeout;

  public DatabaseConnector(DataSource dataSource, Duration validationTimeout) {
    this.dataSource = dataSource;
    this.validationTimeout = validationTimeout;
  }

  @Override
  public DataSource attempt() throws SQLException {
    try (Connection connection = dataSource.getConnection()) {
      final int timeoutSeconds = (int) Math.max(1L, validationTimeout.toSeconds());
      if (!connection.isValid(timeoutSeconds)) {
        throw new SQLException("database connection failed validation");
      }
    }
    return dataSource;
  }
}
