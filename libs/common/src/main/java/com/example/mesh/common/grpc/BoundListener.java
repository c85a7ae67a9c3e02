package com.example.mesh.common.grpc;

import io.grpc.Server;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A started gRPC server; {@link #awaitTermination()} is the serve loop. */
public class BoundListener {

  private static final Logger logger = LoggerFactory.getLogger(BoundListener.class);

  private final Server server;

  public BoundListener(Server server) {
    this.server = server;
  }

  public int port() {
    return server.getPort();
  }

  public void awaitTermination() throws InterruptedException {
    server.awaitTermination();
  }

  public boolean isShutdown() {
    return server.isShutdown();
  }

  public void shutdown(Duration grace) {
    if (server.isShutdown()) {
      return;
    }
    server.shutdown();
    try {
      if (!server.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("grpc server did not drain within grace={} forcing shutdown", grace);
        server.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      server.shutdownNow();
    }
  }
}
