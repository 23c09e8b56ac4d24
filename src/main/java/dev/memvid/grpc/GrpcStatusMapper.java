package dev.memvid.grpc;

import dev.memvid.searcher.SearcherException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Maps backend failures to gRPC statuses. */
final class GrpcStatusMapper {

  private GrpcStatusMapper() {}

  /**
   * Converts a failure, possibly wrapped by a future, into a status exception whose description
   * is the failure message.
   */
  static StatusRuntimeException toStatusException(Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause instanceof SearcherException searcherException) {
      return statusOf(searcherException)
          .withDescription(searcherException.getMessage())
          .asRuntimeException();
    }
    return Status.INTERNAL
        .withDescription("Internal error: " + cause.getMessage())
        .withCause(cause)
        .asRuntimeException();
  }

  static Status statusOf(SearcherException e) {
    return switch (e.getKind()) {
      case NOT_FOUND -> Status.NOT_FOUND;
      case INVALID_REQUEST -> Status.INVALID_ARGUMENT;
      case NOT_READY -> Status.UNAVAILABLE;
      case LOAD_FAILURE, SEARCH_FAILURE, INTERNAL -> Status.INTERNAL;
    };
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
