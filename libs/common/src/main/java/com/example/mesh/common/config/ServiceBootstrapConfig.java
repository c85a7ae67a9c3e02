/*
 * どこで: Common 共通設定
 * 何を: 起動シーケンスを構成する Bean (リトライ・gRPC・health・Consul 登録) を組み立てる
 * なぜ: 各サービスは @Import するだけで同じ起動ライフサイクルを得られるようにするため
 */
package com.example.mesh.common.config;

import com.example.mesh.common.bootstrap.BootstrapMetrics;
import com.example.mesh.common.bootstrap.BootstrapOrchestrator;
import com.example.mesh.common.bootstrap.DatabaseConnector;
import com.example.mesh.common.bootstrap.RetryConnector;
import com.example.mesh.common.bootstrap.SchemaSynchronizer;
import com.example.mesh.common.bootstrap.Sleeper;
import com.example.mesh.common.grpc.GrpcListener;
import com.example.mesh.common.grpc.GrpcMdcInterceptor;
import com.example.mesh.common.grpc.GrpcMetricsInterceptor;
import com.example.mesh.common.grpc.HealthReporter;
import com.example.mesh.common.grpc.RpcMetrics;
import com.example.mesh.common.registry.ConsulRegistrant;
import com.example.mesh.common.registry.HealthCheckDescriptor;
import com.example.mesh.common.registry.RegistryRegistrant;
import io.grpc.BindableService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@Import(TimeConfig.class)
@EnableConfigurationProperties({
  ServiceProperties.class,
  BootstrapProperties.class,
  RegistryProperties.class
})
public class ServiceBootstrapConfig {

  @Bean
  Sleeper bootstrapSleeper() {
    return Sleeper.system();
  }

  @Bean
  BootstrapMetrics bootstrapMetrics(MeterRegistry meterRegistry) {
    return new BootstrapMetrics(meterRegistry);
  }

  @Bean
  RpcMetrics rpcMetrics(MeterRegistry meterRegistry) {
    return new RpcMetrics(meterRegistry);
  }

  @Bean
  RetryConnector databaseRetryConnector(
      BootstrapProperties properties, Sleeper bootstrapSleeper, BootstrapMetrics metrics) {
    return new RetryConnector(properties.database().retryPolicy(), bootstrapSleeper, metrics);
  }

  @Bean
  DatabaseConnector databaseConnector(DataSource dataSource, BootstrapProperties properties) {
    return new DatabaseConnector(dataSource, properties.database().validationTimeout());
  }

  @Bean
  SchemaSynchronizer schemaSynchronizer(BootstrapProperties properties) {
    return new SchemaSynchronizer(properties.schema());
  }

  @Bean
  HealthReporter healthReporter() {
    return new HealthReporter();
  }

  @Bean
  GrpcListener grpcListener(ServiceProperties properties, RpcMetrics rpcMetrics) {
    // 先に登録した interceptor ほど内側で動くため MDC を最後 (最外) に置く
    return new GrpcListener(
        properties.port(),
        List.of(new GrpcMetricsInterceptor(rpcMetrics), new GrpcMdcInterceptor()));
  }

  @Bean
  RestClient consulRestClient(RestClient.Builder builder, RegistryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  RegistryRegistrant consulRegistrant(RestClient consulRestClient, RegistryProperties properties) {
    return new ConsulRegistrant(consulRestClient, properties);
  }

  @Bean
  BootstrapOrchestrator bootstrapOrchestrator(
      BootstrapProperties bootstrapProperties,
      ServiceProperties serviceProperties,
      RegistryProperties registryProperties,
      Sleeper bootstrapSleeper,
      RetryConnector databaseRetryConnector,
      DatabaseConnector databaseConnector,
      SchemaSynchronizer schemaSynchronizer,
      GrpcListener grpcListener,
      HealthReporter healthReporter,
      RegistryRegistrant consulRegistrant,
      List<BindableService> services,
      BootstrapMetrics bootstrapMetrics) {
    return new BootstrapOrchestrator(
        bootstrapProperties,
        bootstrapSleeper,
        databaseRetryConnector,
        databaseConnector,
        schemaSynchronizer,
        grpcListener,
        healthReporter,
        consulRegistrant,
        serviceProperties.identity(),
        HealthCheckDescriptor.grpc(
            serviceProperties.identity(),
            registryProperties.checkInterval(),
            registryProperties.deregisterCriticalAfter()),
        services,
        bootstrapMetrics);
  }
}
