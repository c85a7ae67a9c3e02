package com.example.mesh.gateway.api;

import com.example.mesh.gateway.api.response.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness of the gateway process itself; downstream health is tracked by the registry. */
@RestController
public class HealthController {

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok");
  }
}
