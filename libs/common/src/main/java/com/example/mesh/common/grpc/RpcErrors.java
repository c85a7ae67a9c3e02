/*
 * どこで: Common gRPC 基盤
 * 何を: ストア例外と入力不備を gRPC Status へ変換する
 * なぜ: 「未検出」と「ストア到達不能」を呼び出し側が区別できるコードで返すため
 */
package com.example.mesh.common.grpc;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;

public final class RpcErrors {
  private RpcErrors() {}

  public static StatusRuntimeException invalidArgument(String message) {
    return Status.INVALID_ARGUMENT.withDescription(message).asRuntimeException();
  }

  public static StatusRuntimeException notFound(String entity, String id) {
    return Status.NOT_FOUND.withDescription(entity + " not found: " + id).asRuntimeException();
  }

  public static StatusRuntimeException fromStore(DataAccessException ex) {
    final String description = describe(ex);
    if (ex instanceof DuplicateKeyException) {
      return Status.ALREADY_EXISTS.withDescription(description).withCause(ex).asRuntimeException();
    }
    if (ex instanceof QueryTimeoutException) {
      return Status.DEADLINE_EXCEEDED
          .withDescription(description)
          .withCause(ex)
          .asRuntimeException();
    }
    if (ex instanceof TransientDataAccessException
        || ex instanceof DataAccessResourceFailureException) {
      return Status.UNAVAILABLE.withDescription(description).withCause(ex).asRuntimeException();
    }
    return Status.INTERNAL.withDescription(description).withCause(ex).asRuntimeException();
  }

  public static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw invalidArgument(field + " is required");
    }
    return value;
  }

  public static long parseId(String raw) {
    if (raw == null || raw.isBlank()) {
      throw invalidArgument("id is required");
    }
    try {
      final long id = Long.parseLong(raw.trim());
      if (id <= 0) {
        throw invalidArgument("id must be positive: " + raw);
      }
      return id;
    } catch (NumberFormatException ex) {
      throw invalidArgument("id must be numeric: " + raw);
    }
  }

  private static String describe(DataAccessException ex) {
    final Throwable cause = ex.getMostSpecificCause();
    final String message = cause.getMessage();
    return message == null ? ex.getClass().getSimpleName() : message;
  }
}
