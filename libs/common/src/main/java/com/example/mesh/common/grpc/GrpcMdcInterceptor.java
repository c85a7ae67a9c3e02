package com.example.mesh.common.grpc;

import com.example.mesh.common.TraceIds;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.net.SocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.MDC;

public class GrpcMdcInterceptor implements ServerInterceptor {

  public static final Metadata.Key<String> REQUEST_ID_HEADER =
      Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    final Map<String, String> context = new LinkedHashMap<>();
    put(context, "request_id", TraceIds.resolve(headers.get(REQUEST_ID_HEADER)));
    put(context, "rpc_method", call.getMethodDescriptor().getFullMethodName());
    put(context, "peer", resolvePeer(call));
    final ServerCall.Listener<ReqT> delegate =
        callWithMdc(context, () -> next.startCall(call, headers));
    // unary ハンドラは onHalfClose のスレッドで動くため各コールバックで MDC を張り直す
    return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
      @Override
      public void onMessage(ReqT message) {
        runWithMdc(context, () -> super.onMessage(message));
      }

      @Override
      public void onHalfClose() {
        runWithMdc(context, super::onHalfClose);
      }

      @Override
      public void onCancel() {
        runWithMdc(context, super::onCancel);
      }

      @Override
      public void onComplete() {
        runWithMdc(context, super::onComplete);
      }

      @Override
      public void onReady() {
        runWithMdc(context, super::onReady);
      }
    };
  }

  private String resolvePeer(ServerCall<?, ?> call) {
    final SocketAddress remote = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
    return remote == null ? null : remote.toString();
  }

  private void runWithMdc(Map<String, String> context, Runnable action) {
    callWithMdc(
        context,
        () -> {
          action.run();
          return null;
        });
  }

  private <T> T callWithMdc(Map<String, String> context, Supplier<T> action) {
    context.forEach(MDC::put);
    try {
      return action.get();
    } finally {
      context.keySet().forEach(MDC::remove);
    }
  }

  private void put(Map<String, String> context, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    context.put(key, value);
  }
}
