/*
 * どこで: Users gRPC API
 * 何を: CreateUser / GetUser を受け付け、入力検証とストア例外の Status 変換を行う
 * なぜ: 呼び出し側が「不正入力」「未検出」「重複」「ストア障害」を区別できるようにするため
 */
package com.example.mesh.users.api;

import com.example.mesh.common.grpc.RpcErrors;
import com.example.mesh.proto.users.CreateUserRequest;
import com.example.mesh.proto.users.GetUserRequest;
import com.example.mesh.proto.users.User;
import com.example.mesh.proto.users.UserResponse;
import com.example.mesh.proto.users.UserServiceGrpc;
import com.example.mesh.users.model.NewUser;
import com.example.mesh.users.model.UserRecord;
import com.example.mesh.users.service.UserService;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserGrpcService extends UserServiceGrpc.UserServiceImplBase {

  private static final Logger logger = LoggerFactory.getLogger(UserGrpcService.class);

  private final UserService userService;

  @Override
  public void createUser(
      CreateUserRequest request, StreamObserver<UserResponse> responseObserver) {
    try {
      final NewUser user =
          new NewUser(
              RpcErrors.requireText(request.getName(), "name"),
              RpcErrors.requireText(request.getEmail(), "email"));
      respond(responseObserver, userService.createUser(user));
    } catch (StatusRuntimeException ex) {
      responseObserver.onError(ex);
    } catch (DataAccessException ex) {
      logger.warn("create user failed cause={}", ex.getMostSpecificCause().toString());
      responseObserver.onError(RpcErrors.fromStore(ex));
    }
  }

  @Override
  public void getUser(GetUserRequest request, StreamObserver<UserResponse> responseObserver) {
    try {
      final long id = RpcErrors.parseId(request.getId());
      final UserRecord user =
          userService.findUser(id).orElseThrow(() -> RpcErrors.notFound("user", request.getId()));
      respond(responseObserver, user);
    } catch (StatusRuntimeException ex) {
      responseObserver.onError(ex);
    } catch (DataAccessException ex) {
      logger.warn(
          "get user failed id={} cause={}",
          request.getId(),
          ex.getMostSpecificCause().toString());
      responseObserver.onError(RpcErrors.fromStore(ex));
    }
  }

  private void respond(StreamObserver<UserResponse> responseObserver, UserRecord user) {
    responseObserver.onNext(UserResponse.newBuilder().setUser(toProto(user)).build());
    responseObserver.onCompleted();
  }

  static User toProto(UserRecord user) {
    return User.newBuilder()
        .setId(Long.toString(user.id()))
        .setName(user.name())
        .setEmail(user.email())
        .build();
  }
}
