package com.example.mesh.products.api;

import com.example.mesh.common.grpc.RpcErrors;
import com.example.mesh.products.model.NewProduct;
import com.example.mesh.products.model.ProductRecord;
import com.example.mesh.products.service.ProductService;
import com.example.mesh.proto.products.CreateProductRequest;
import com.example.mesh.proto.products.GetProductRequest;
import com.example.mesh.proto.products.Product;
import com.example.mesh.proto.products.ProductResponse;
import com.example.mesh.proto.products.ProductServiceGrpc;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProductGrpcService extends ProductServiceGrpc.ProductServiceImplBase {

  private static final Logger logger = LoggerFactory.getLogger(ProductGrpcService.class);

  private final ProductService productService;

  @Override
  public void createProduct(
      CreateProductRequest request, StreamObserver<ProductResponse> responseObserver) {
    try {
      final String name = RpcErrors.requireText(request.getName(), "name");
      final double price = request.getPrice();
      if (!Double.isFinite(price) || price < 0) {
        throw RpcErrors.invalidArgument("price must be a finite non-negative number: " + price);
      }
      respond(responseObserver, productService.createProduct(new NewProduct(name, price)));
    } catch (StatusRuntimeException ex) {
      responseObserver.onError(ex);
    } catch (DataAccessException ex) {
      logger.warn("create product failed cause={}", ex.getMostSpecificCause().toString());
      responseObserver.onError(RpcErrors.fromStore(ex));
    }
  }

  @Override
  public void getProduct(
      GetProductRequest request, StreamObserver<ProductResponse> responseObserver) {
    try {
      final long id = RpcErrors.parseId(request.getId());
      final ProductRecord product =
          productService
              .findProduct(id)
              .orElseThrow(() -> RpcErrors.notFound("product", request.getId()));
      respond(responseObserver, product);
    } catch (StatusRuntimeException ex) {
      responseObserver.onError(ex);
    } catch (DataAccessException ex) {
      logger.warn(
          "get product failed id={} cause={}",
          request.getId(),
          ex.getMostSpecificCause().toString());
      responseObserver.onError(RpcErrors.fromStore(ex));
    }
  }

  private void respond(StreamObserver<ProductResponse> responseObserver, ProductRecord product) {
    responseObserver.onNext(ProductResponse.newBuilder().setProduct(toProto(product)).build());
    responseObserver.onCompleted();
  }

  static Product toProto(ProductRecord product) {
    return Product.newBuilder()
        .setId(Long.toString(product.id()))
        .setName(product.name())
        .setPrice(product.price())
        .build();
  }
}
