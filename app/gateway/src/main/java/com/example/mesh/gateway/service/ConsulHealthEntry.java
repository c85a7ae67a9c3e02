package com.example.mesh.gateway.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One element of Consul's {@code /v1/health/service/{name}} response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsulHealthEntry(
    @JsonProperty("Node") Node node, @JsonProperty("Service") Service service) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Node(@JsonProperty("Address") String address) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Service(
      @JsonProperty("ID") String id,
      @JsonProperty("Address") String address,
      @JsonProperty("Port") int port) {}
}
