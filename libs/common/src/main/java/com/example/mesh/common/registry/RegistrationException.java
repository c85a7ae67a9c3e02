package com.example.mesh.common.registry;

public class RegistrationException extends RuntimeException {

  public RegistrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
