/*
 * どこで: products-service の結合テスト
 * 何を: 実 PostgreSQL と in-process gRPC で CreateProduct → GetProduct の往復を検証する
 * なぜ: 採番された id で同一レコードが読み戻せることを gRPC 境界で保証するため
 */
package com.example.mesh.products;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.common.bootstrap.SchemaSynchronizer;
import com.example.mesh.products.api.ProductGrpcService;
import com.example.mesh.proto.products.CreateProductRequest;
import com.example.mesh.proto.products.GetProductRequest;
import com.example.mesh.proto.products.Product;
import com.example.mesh.proto.products.ProductServiceGrpc;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import java.io.IOException;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ProductsServiceIntegrationTest {

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
  @Autowired private ProductGrpcService productGrpcService;

  private Server server;
  private ManagedChannel channel;

  @BeforeEach
  void setUp() throws IOException {
    schemaSynchronizer.synchronize(dataSource);
    final String name = InProcessServerBuilder.generateName();
    server = InProcessServerBuilder.forName(name).addService(productGrpcService).build().start();
    channel = InProcessChannelBuilder.forName(name).build();
  }

  @AfterEach
  void tearDown() {
    channel.shutdownNow();
    server.shutdownNow();
  }

  @Test
  void createdWidgetReadsBackIdentically() {
    final ProductServiceGrpc.ProductServiceBlockingStub stub =
        ProductServiceGrpc.newBlockingStub(channel);

    final Product created =
        stub.createProduct(
                CreateProductRequest.newBuilder().setName("Widget").setPrice(9.99d).build())
            .getProduct();
    final Product fetched =
        stub.getProduct(GetProductRequest.newBuilder().setId(created.getId()).build())
            .getProduct();

    assertThat(created.getId()).isNotEmpty();
    assertThat(created.getName()).isEqualTo("Widget");
    assertThat(created.getPrice()).isEqualTo(9.99d);
    assertThat(fetched).isEqualTo(created);
  }
}
