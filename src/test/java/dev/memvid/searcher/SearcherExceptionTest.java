package dev.memvid.searcher;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class SearcherExceptionTest {

  @Test
  void message_combines_kind_description_and_detail() {
    assertThat(SearcherException.notFound("/data/x.mv2"))
        .hasMessage("Memvid file not found: /data/x.mv2");
    assertThat(SearcherException.invalidRequest("Query cannot be empty"))
        .hasMessage("Invalid request: Query cannot be empty");
    assertThat(SearcherException.searchFailure("Search error: boom", new RuntimeException()))
        .hasMessage("Search failed: Search error: boom");
  }

  @Test
  void message_without_detail_is_kind_description() {
    assertThat(SearcherException.notReady()).hasMessage("Service not ready");
  }

  @Test
  void factories_set_kind_and_cause() {
    IOException cause = new IOException("corrupt");

    SearcherException e = SearcherException.loadFailure("corrupt", cause);

    assertThat(e.getKind()).isEqualTo(ErrorKind.LOAD_FAILURE);
    assertThat(e).hasCause(cause);
    assertThat(SearcherException.internal("Task error: x", null).getKind())
        .isEqualTo(ErrorKind.INTERNAL);
  }
}
