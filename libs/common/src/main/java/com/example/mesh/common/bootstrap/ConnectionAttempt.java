package com.example.mesh.common.bootstrap;

/** One try at obtaining a handle to a dependency; any exception counts as a failed attempt. */
@FunctionalInterface
public interface ConnectionAttempt<T> {

  T attempt() throws Exception;
}
