package com.example.mesh.gateway.service;

import com.example.mesh.gateway.api.request.UserCreateRequest;
import com.example.mesh.gateway.api.response.UserResponse;
import com.example.mesh.gateway.config.GatewayProperties;
import com.example.mesh.proto.users.CreateUserRequest;
import com.example.mesh.proto.users.GetUserRequest;
import com.example.mesh.proto.users.User;
import com.example.mesh.proto.users.UserServiceGrpc;
import io.grpc.Channel;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

@Service
public class UsersClient extends GrpcDownstreamClient {

  private final Duration deadline;

  public UsersClient(
      ConsulServiceResolver resolver,
      GrpcChannelPool channelPool,
      GatewayMetrics metrics,
      GatewayProperties properties) {
    super(resolver, channelPool, metrics, properties.usersService());
    this.deadline = properties.callDeadline();
  }

  public UserResponse createUser(UserCreateRequest request) {
    final CreateUserRequest message =
        CreateUserRequest.newBuilder().setName(request.name()).setEmail(request.email()).build();
    return toResponse(call("CreateUser", channel -> stub(channel).createUser(message).getUser()));
  }

  public UserResponse getUser(String id) {
    final GetUserRequest message = GetUserRequest.newBuilder().setId(id).build();
    return toResponse(call("GetUser", channel -> stub(channel).getUser(message).getUser()));
  }

  private UserServiceGrpc.UserServiceBlockingStub stub(Channel channel) {
    return UserServiceGrpc.newBlockingStub(channel)
        .withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
  }

  private UserResponse toResponse(User user) {
    return new UserResponse(user.getId(), user.getName(), user.getEmail());
  }
}
