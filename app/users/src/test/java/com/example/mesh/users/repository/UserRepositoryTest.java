package com.example.mesh.users.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.mesh.common.bootstrap.SchemaSynchronizer;
import com.example.mesh.users.model.NewUser;
import com.example.mesh.users.model.UserRecord;
import java.util.Optional;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class UserRepositoryTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired private SchemaSynchronizer schemaSynchronizer;
  @Autowired private DataSource dataSource;
  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void synchronizeAndClean() {
    // 起動シーケンスと同じ経路でテーブルを作る (2 回目以降は no-op)
    schemaSynchronizer.synchronize(dataSource);
    jdbcTemplate.update("DELETE FROM users.users", new MapSqlParameterSource());
  }

  @Test
  void insertThenFindReturnsSameFields() {
    final UserRecord created = userRepository.insert(new NewUser("Ada", "ada@example.com"));

    final Optional<UserRecord> found = userRepository.findById(created.id());

    assertThat(created.id()).isPositive();
    assertThat(found).isPresent();
    assertThat(found.get().name()).isEqualTo("Ada");
    assertThat(found.get().email()).isEqualTo("ada@example.com");
  }

  @Test
  void separateInsertsGetDistinctIds() {
    final UserRecord first = userRepository.insert(new NewUser("Ada", "ada1@example.com"));
    final UserRecord second = userRepository.insert(new NewUser("Ada", "ada2@example.com"));

    assertThat(first.id()).isNotEqualTo(second.id());
  }

  @Test
  void duplicateEmailIsRejected() {
    userRepository.insert(new NewUser("Ada", "ada@example.com"));

    assertThatThrownBy(() -> userRepository.insert(new NewUser("Other", "ada@example.com")))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void softDeletedRowIsInvisible() {
    final UserRecord created = userRepository.insert(new NewUser("Ada", "ada@example.com"));
    jdbcTemplate.update(
        "UPDATE users.users SET deleted_at = now() WHERE id = :id",
        new MapSqlParameterSource().addValue("id", created.id()));

    assertThat(userRepository.findById(created.id())).isEmpty();
  }

  @Test
  void findByUnknownIdIsEmpty() {
    assertThat(userRepository.findById(999_999L)).isEmpty();
  }
}
