/*
 * どこで: Products 永続化
 * 何を: products テーブルへの挿入と id 指定の取得を行う
 * なぜ: id 採番をストアに任せ、論理削除済みの行を読み出しから除外するため
 */
package com.example.mesh.products.repository;

import com.example.mesh.products.model.NewProduct;
import com.example.mesh.products.model.ProductRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  public ProductRecord insert(NewProduct product) {
    final String sql =
        """
        INSERT INTO products (name, price, created_at, updated_at)
        VALUES (:name, :price, :createdAt, :updatedAt)
        RETURNING id, name, price, created_at, updated_at
        """;
    final Timestamp now = Timestamp.from(clock.instant());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", product.name())
            .addValue("price", product.price())
            .addValue("createdAt", now)
            .addValue("updatedAt", now);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ProductRecord> findById(long id) {
    final String sql =
        """
        SELECT id, name, price, created_at, updated_at
        FROM products
        WHERE id = :id AND deleted_at IS NULL
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ProductRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProductRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getDouble("price"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
