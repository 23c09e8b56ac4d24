package dev.memvid.searcher;

import static dev.memvid.searcher.Searcher.MAX_SNIPPET_CHARS;
import static dev.memvid.searcher.Searcher.MAX_TOP_K;
import static dev.memvid.searcher.Searcher.MIN_SNIPPET_CHARS;
import static dev.memvid.searcher.Searcher.MIN_TOP_K;

import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Validation and clamping applied by every backend before touching its data. */
final class RequestLimits {

  private RequestLimits() {}

  static int clampTopK(int topK) {
    return Math.max(MIN_TOP_K, Math.min(MAX_TOP_K, topK));
  }

  static int clampSnippetChars(int snippetChars) {
    return Math.max(MIN_SNIPPET_CHARS, Math.min(MAX_SNIPPET_CHARS, snippetChars));
  }

  /**
   * Rejects null, empty and whitespace-only text.
   *
   * @throws SearcherException with {@link ErrorKind#INVALID_REQUEST}
   */
  static String requireText(@Nullable String text, String field) {
    if (text == null || text.isBlank()) {
      throw SearcherException.invalidRequest(field + " cannot be empty");
    }
    return text;
  }

  /**
   * Serializes filters to a scope expression: {@code key:value} pairs joined by a space, in map
   * iteration order.
   *
   * @return the expression, or null when there are no filters
   */
  static @Nullable String scopeExpression(Map<String, String> filters) {
    if (filters.isEmpty()) {
      return null;
    }
    return filters.entrySet().stream()
        .map(e -> e.getKey() + ":" + e.getValue())
        .collect(Collectors.joining(" "));
  }
}
