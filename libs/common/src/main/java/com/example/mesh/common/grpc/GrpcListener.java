/*
 * どこで: Common gRPC 基盤
 * 何を: 設定ポートに bind し、ドメインサービス・health・reflection を登録して起動する
 * なぜ: bind 失敗 (ポート使用中など) をリトライせず即座に致命的失敗として返すため
 */
package com.example.mesh.common.grpc;

import io.grpc.BindableService;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.protobuf.services.ProtoReflectionServiceV1;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GrpcListener {

  private static final Logger logger = LoggerFactory.getLogger(GrpcListener.class);

  private final int port;
  private final List<ServerInterceptor> interceptors;

  public GrpcListener(int port, List<ServerInterceptor> interceptors) {
    this.port = port;
    this.interceptors = List.copyOf(interceptors);
  }

  public BoundListener bind(List<? extends BindableService> services, HealthReporter healthReporter)
      throws IOException {
    final ServerBuilder<?> builder =
        Grpc.newServerBuilderForPort(port, InsecureServerCredentials.create());
    for (BindableService service : services) {
      final ServerServiceDefinition definition = service.bindService();
      builder.addService(ServerInterceptors.intercept(definition, interceptors));
      healthReporter.track(definition.getServiceDescriptor().getName());
    }
    builder.addService(healthReporter.healthService());
    builder.addService(ProtoReflectionServiceV1.newInstance());
    final Server server = builder.build().start();
    logger.info(
        "grpc listener bound port={} services={}",
        server.getPort(),
        healthReporter.trackedServices());
    return new BoundListener(server);
  }
}
