package com.example.mesh.products;

import com.example.mesh.common.bootstrap.ServiceLauncher;
import com.example.mesh.common.config.ServiceBootstrapConfig;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(ServiceBootstrapConfig.class)
public class ProductsApplication {

  public static void main(String[] args) {
    ServiceLauncher.launch(ProductsApplication.class, args);
  }
}
