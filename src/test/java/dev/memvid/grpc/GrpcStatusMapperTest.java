package dev.memvid.grpc;

import static org.assertj.core.api.Assertions.assertThat;

import dev.memvid.searcher.ErrorKind;
import dev.memvid.searcher.SearcherException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GrpcStatusMapperTest {

  @ParameterizedTest
  @CsvSource({
    "NOT_FOUND, NOT_FOUND",
    "LOAD_FAILURE, INTERNAL",
    "SEARCH_FAILURE, INTERNAL",
    "INVALID_REQUEST, INVALID_ARGUMENT",
    "NOT_READY, UNAVAILABLE",
    "INTERNAL, INTERNAL"
  })
  void every_error_kind_maps_to_its_status(ErrorKind kind, Status.Code code) {
    SearcherException e = new SearcherException(kind, "detail", null);

    StatusRuntimeException status = GrpcStatusMapper.toStatusException(e);

    assertThat(status.getStatus().getCode()).isEqualTo(code);
    assertThat(status.getStatus().getDescription()).isEqualTo(kind.description() + ": detail");
  }

  @Test
  void completion_wrappers_are_unwrapped() {
    CompletionException wrapped = new CompletionException(SearcherException.notReady());

    StatusRuntimeException status = GrpcStatusMapper.toStatusException(wrapped);

    assertThat(status.getStatus().getCode()).isEqualTo(Status.Code.UNAVAILABLE);
    assertThat(status.getStatus().getDescription()).isEqualTo("Service not ready");
  }

  @Test
  void unknown_throwable_is_internal() {
    StatusRuntimeException status =
        GrpcStatusMapper.toStatusException(new CompletionException(new NullPointerException("x")));

    assertThat(status.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
    assertThat(status.getStatus().getDescription()).isEqualTo("Internal error: x");
  }
}
