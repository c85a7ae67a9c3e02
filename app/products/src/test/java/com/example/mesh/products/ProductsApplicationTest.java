package com.example.mesh.products;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.common.bootstrap.BootstrapOrchestrator;
import com.example.mesh.common.bootstrap.BootstrapState;
import com.example.mesh.common.config.BootstrapProperties;
import com.example.mesh.common.config.RegistryProperties;
import com.example.mesh.common.config.ServiceProperties;
import com.example.mesh.products.api.ProductGrpcService;
import io.grpc.BindableService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ProductsApplicationTest {

  @Autowired private BootstrapOrchestrator orchestrator;
  @Autowired private ServiceProperties serviceProperties;
  @Autowired private BootstrapProperties bootstrapProperties;
  @Autowired private RegistryProperties registryProperties;
  @Autowired private List<BindableService> services;

  @Test
  void wiresProductServiceAndBootstrapSettings() {
    assertThat(orchestrator.state()).isEqualTo(BootstrapState.INIT);
    assertThat(services).hasAtLeastOneElementOfType(ProductGrpcService.class);
    assertThat(serviceProperties.identity().target()).isEqualTo("products-service:50052");
    assertThat(bootstrapProperties.database().maxAttempts()).isEqualTo(30);
    assertThat(bootstrapProperties.schema().name()).isEqualTo("products");
    assertThat(registryProperties.baseUrl()).isEqualTo("http://127.0.0.1:18500");
  }
}
