package com.example.mesh.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.common.bootstrap.RetryPolicy;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class BootstrapPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void defaultsMatchFixedThirtyAttemptsTenSecondsApart() {
    contextRunner.run(
        context -> {
          final BootstrapProperties bootstrap = context.getBean(BootstrapProperties.class);
          final RetryPolicy policy = bootstrap.database().retryPolicy();
          assertThat(bootstrap.settleDelay()).isEqualTo(Duration.ofSeconds(10));
          assertThat(bootstrap.startupTimeout()).isNull();
          assertThat(policy.maxAttempts()).isEqualTo(30);
          assertThat(policy.delay()).isEqualTo(Duration.ofSeconds(10));
          assertThat(policy.backoff()).isEqualTo(RetryPolicy.Backoff.FIXED);
          assertThat(bootstrap.schema().name()).isEqualTo("public");
          assertThat(bootstrap.schema().locations()).containsExactly("classpath:db/migration");

          final RegistryProperties registry = context.getBean(RegistryProperties.class);
          assertThat(registry.baseUrl()).isEqualTo("http://127.0.0.1:8500");
          assertThat(registry.checkInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(registry.deregisterCriticalAfter()).isEqualTo(Duration.ofSeconds(30));
          assertThat(registry.token()).isEmpty();
        });
  }

  @Test
  void bindsOverrides() {
    contextRunner
        .withPropertyValues(
            "mesh.bootstrap.settle-delay=0s",
            "mesh.bootstrap.startup-timeout=5m",
            "mesh.bootstrap.database.max-attempts=5",
            "mesh.bootstrap.database.retry-delay=2s",
            "mesh.bootstrap.database.backoff=exponential",
            "mesh.bootstrap.database.jitter-ratio=0.2",
            "mesh.bootstrap.schema.name=users",
            "mesh.bootstrap.schema.locations=classpath:db/users",
            "mesh.registry.address=https://consul.internal:8501",
            "mesh.registry.token=abc")
        .run(
            context -> {
              final BootstrapProperties bootstrap = context.getBean(BootstrapProperties.class);
              assertThat(bootstrap.settleDelay()).isZero();
              assertThat(bootstrap.startupTimeout()).isEqualTo(Duration.ofMinutes(5));
              assertThat(bootstrap.database().maxAttempts()).isEqualTo(5);
              assertThat(bootstrap.database().backoff())
                  .isEqualTo(RetryPolicy.Backoff.EXPONENTIAL);
              assertThat(bootstrap.database().jitterRatio()).isEqualTo(0.2d);
              assertThat(bootstrap.schema().name()).isEqualTo("users");
              assertThat(bootstrap.schema().locations()).isEqualTo(List.of("classpath:db/users"));

              final RegistryProperties registry = context.getBean(RegistryProperties.class);
              assertThat(registry.baseUrl()).isEqualTo("https://consul.internal:8501");
              assertThat(registry.token()).isEqualTo("abc");
            });
  }

  @Configuration
  @EnableConfigurationProperties({BootstrapProperties.class, RegistryProperties.class})
  static class TestConfiguration {}
}
