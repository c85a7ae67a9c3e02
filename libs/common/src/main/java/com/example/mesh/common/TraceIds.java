package com.example.mesh.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate;
    }
    return newTraceId();
  }
}
