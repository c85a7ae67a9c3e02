package com.example.mesh.common.registry;

public interface RegistryRegistrant {

  /**
   * Advertises the service to the discovery registry.
   *
   * @throws RegistrationException when the registry cannot be reached or rejects the record
   */
  void register(ServiceIdentity identity, HealthCheckDescriptor healthCheck);
}
