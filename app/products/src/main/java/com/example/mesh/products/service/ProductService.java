package com.example.mesh.products.service;

import com.example.mesh.products.model.NewProduct;
import com.example.mesh.products.model.ProductRecord;
import com.example.mesh.products.repository.ProductRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProductService {

  private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

  private final ProductRepository productRepository;

  public ProductRecord createProduct(NewProduct product) {
    final ProductRecord created = productRepository.insert(product);
    logger.info("product created id={} price={}", created.id(), created.price());
    return created;
  }

  public Optional<ProductRecord> findProduct(long id) {
    return productRepository.findById(id);
  }
}
