package com.example.mesh.common.bootstrap;

public class RetryExhaustedException extends RuntimeException {

  private final String dependency;
  private final int attempts;

  public RetryExhaustedException(String dependency, int attempts, Throwable lastFailure) {
    super("could not connect to " + dependency + " after " + attempts + " attempts", lastFailure);
    this.dependency = dependency;
    this.attempts = attempts;
  }

  public String dependency() {
    return dependency;
  }

  public int attempts() {
    return attempts;
  }
}
