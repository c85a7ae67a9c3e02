/*
 * どこで: Common 起動シーケンス
 * 何を: DB_READY 後に Flyway でテーブルを create-if-absent で同期する
 * なぜ: Spring Boot の自動 migrate はリトライ前に走ってしまうため起動シーケンスから明示実行する
 */
package com.example.mesh.common.bootstrap;

import com.example.mesh.common.config.BootstrapProperties;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SchemaSynchronizer {

  private static final Logger logger = LoggerFactory.getLogger(SchemaSynchronizer.class);

  private final BootstrapProperties.Schema schema;

  public SchemaSynchronizer(BootstrapProperties.Schema schema) {
    this.schema = schema;
  }

  public void synchronize(DataSource dataSource) {
    final Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .schemas(schema.name())
            .defaultSchema(schema.name())
            .createSchemas(true)
            .table(schema.historyTable())
            .locations(schema.locations().toArray(String[]::new))
            .load();
    final MigrateResult result = flyway.migrate();
    logger.info(
        "schema synchronized schema={} migrationsExecuted={} targetVersion={}",
        schema.name(),
        result.migrationsExecuted,
        result.targetSchemaVersion);
  }
}
