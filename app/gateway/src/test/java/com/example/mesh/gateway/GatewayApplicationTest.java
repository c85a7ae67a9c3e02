package com.example.mesh.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.common.config.RegistryProperties;
import com.example.mesh.gateway.config.GatewayProperties;
import com.example.mesh.gateway.service.GrpcChannelPool;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class GatewayApplicationTest {

  @Autowired private GatewayProperties gatewayProperties;
  @Autowired private RegistryProperties registryProperties;
  @Autowired private GrpcChannelPool channelPool;

  @Test
  void contextStartsWithoutContactingRegistry() {
    assertThat(channelPool.size()).isZero();
    assertThat(registryProperties.baseUrl()).isEqualTo("http://127.0.0.1:18500");
  }

  @Test
  void bindsDownstreamNamesAndDeadline() {
    assertThat(gatewayProperties.usersService()).isEqualTo("users-service");
    assertThat(gatewayProperties.productsService()).isEqualTo("products-service");
    assertThat(gatewayProperties.callDeadline()).isEqualTo(Duration.ofSeconds(5));
  }
}
