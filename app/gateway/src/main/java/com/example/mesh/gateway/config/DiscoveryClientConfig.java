/*
 * どこで: Gateway 設定
 * 何を: Consul agent 呼び出し用 RestClient と gRPC チャネルプールを提供する
 * なぜ: 下流の発見 (HTTP) と呼び出し (gRPC) の接続設定を一箇所に集めるため
 */
package com.example.mesh.gateway.config;

import com.example.mesh.common.config.RegistryProperties;
import com.example.mesh.gateway.service.GrpcChannelPool;
import com.example.mesh.gateway.service.RequestIdClientInterceptor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({GatewayProperties.class, RegistryProperties.class})
public class DiscoveryClientConfig {

  @Bean
  RestClient consulRestClient(RestClient.Builder builder, RegistryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean(destroyMethod = "close")
  GrpcChannelPool grpcChannelPool() {
    return GrpcChannelPool.plaintext(new RequestIdClientInterceptor());
  }
}
