package com.example.mesh.gateway.service;

import com.example.mesh.gateway.api.request.ProductCreateRequest;
import com.example.mesh.gateway.api.response.ProductResponse;
import com.example.mesh.gateway.config.GatewayProperties;
import com.example.mesh.proto.products.CreateProductRequest;
import com.example.mesh.proto.products.GetProductRequest;
import com.example.mesh.proto.products.Product;
import com.example.mesh.proto.products.ProductServiceGrpc;
import io.grpc.Channel;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

@Service
public class ProductsClient extends GrpcDownstreamClient {

  private final Duration deadline;

  public ProductsClient(
      ConsulServiceResolver resolver,
      GrpcChannelPool channelPool,
      GatewayMetrics metrics,
      GatewayProperties properties) {
    super(resolver, channelPool, metrics, properties.productsService());
    this.deadline = properties.callDeadline();
  }

  public ProductResponse createProduct(ProductCreateRequest request) {
    final CreateProductRequest message =
        CreateProductRequest.newBuilder()
            .setName(request.name())
            .setPrice(request.price())
            .build();
    return toResponse(
        call("CreateProduct", channel -> stub(channel).createProduct(message).getProduct()));
  }

  public ProductResponse getProduct(String id) {
    final GetProductRequest message = GetProductRequest.newBuilder().setId(id).build();
    return toResponse(
        call("GetProduct", channel -> stub(channel).getProduct(message).getProduct()));
  }

  private ProductServiceGrpc.ProductServiceBlockingStub stub(Channel channel) {
    return ProductServiceGrpc.newBlockingStub(channel)
        .withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
  }

  private ProductResponse toResponse(Product product) {
    return new ProductResponse(product.getId(), product.getName(), product.getPrice());
  }
}
