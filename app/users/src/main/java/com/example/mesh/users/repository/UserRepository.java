package com.example.mesh.users.repository;

import com.example.mesh.users.model.NewUser;
import com.example.mesh.users.model.UserRecord;
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
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  public UserRecord insert(NewUser user) {
    final String sql =
        """
        INSERT INTO users (name, email, created_at, updated_at)
        VALUES (:name, :email, :createdAt, :updatedAt)
        RETURNING id, name, email, created_at, updated_at
        """;
    final Timestamp now = Timestamp.from(clock.instant());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", user.name())
            .addValue("email", user.email())
            .addValue("createdAt", now)
            .addValue("updatedAt", now);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<UserRecord> findById(long id) {
    // 論理削除済みの行は存在しないものとして扱う
    final String sql =
        """
        SELECT id, name, email, created_at, updated_at
        FROM users
        WHERE id = :id AND deleted_at IS NULL
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
