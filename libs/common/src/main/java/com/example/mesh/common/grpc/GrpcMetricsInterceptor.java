package com.example.mesh.common.grpc;

import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.time.Duration;

public class GrpcMetricsInterceptor implements ServerInterceptor {

  private final RpcMetrics metrics;

  public GrpcMetricsInterceptor(RpcMetrics metrics) {
    this.metrics = metrics;
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    final long startedAt = System.nanoTime();
    final String method = call.getMethodDescriptor().getFullMethodName();
    final ServerCall<ReqT, RespT> recording =
        new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
          @Override
          public void close(Status status, Metadata trailers) {
            metrics.recordCall(
                method,
                status.getCode().name(),
                Duration.ofNanos(System.nanoTime() - startedAt));
            super.close(status, trailers);
          }
        };
    return next.startCall(recording, headers);
  }
}
