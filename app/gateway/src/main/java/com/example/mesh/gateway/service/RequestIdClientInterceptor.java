package com.example.mesh.gateway.service;

import com.example.mesh.common.grpc.GrpcMdcInterceptor;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import org.slf4j.MDC;

/** Copies the HTTP request id from MDC into outgoing gRPC metadata. */
public class RequestIdClientInterceptor implements ClientInterceptor {

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    // MDC はリクエストスレッドで読む (start は別スレッドになり得る)
    final String requestId = MDC.get("request_id");
    return new ForwardingClientCall.SimpleForwardingClientCall<>(
        next.newCall(method, callOptions)) {
      @Override
      public void start(Listener<RespT> responseListener, Metadata headers) {
        if (requestId != null && !requestId.isBlank()) {
          headers.put(GrpcMdcInterceptor.REQUEST_ID_HEADER, requestId);
        }
        super.start(responseListener, headers);
      }
    };
  }
}
