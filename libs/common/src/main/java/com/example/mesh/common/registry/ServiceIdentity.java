package com.example.mesh.common.registry;

public record ServiceIdentity(String name, String address, int port) {

  public String target() {
    return address + ":" + port;
  }
}
