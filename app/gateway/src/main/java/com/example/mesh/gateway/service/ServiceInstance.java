package com.example.mesh.gateway.service;

/** A passing instance of a logical service as reported by the registry. */
public record ServiceInstance(String service, String host, int port) {

  public String target() {
    return host + ":" + port;
  }
}
