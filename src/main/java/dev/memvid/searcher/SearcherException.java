package dev.memvid.searcher;

import org.jspecify.annotations.Nullable;

/**
 * Unchecked failure raised by a {@link Searcher}. Asynchronous operations deliver it as the cause
 * of an exceptionally completed future.
 */
public class SearcherException extends RuntimeException {

  private final ErrorKind kind;

  public SearcherException(ErrorKind kind, @Nullable String detail, @Nullable Throwable cause) {
    super(formatMessage(kind, detail), cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static SearcherException notFound(String path) {
    return new SearcherException(ErrorKind.NOT_FOUND, path, null);
  }

  public static SearcherException loadFailure(String detail, Throwable cause) {
    return new SearcherException(ErrorKind.LOAD_FAILURE, detail, cause);
  }

  public static SearcherException searchFailure(String detail, Throwable cause) {
    return new SearcherException(ErrorKind.SEARCH_FAILURE, detail, cause);
  }

  public static SearcherException invalidRequest(String detail) {
    return new SearcherException(ErrorKind.INVALID_REQUEST, detail, null);
  }

  public static SearcherException notReady() {
    return new SearcherException(ErrorKind.NOT_READY, null, null);
  }

  public static SearcherException internal(String detail, @Nullable Throwable cause) {
    return new SearcherException(ErrorKind.INTERNAL, detail, cause);
  }

  private static String formatMessage(ErrorKind kind, @Nullable String detail) {
    return detail == null ? kind.description() : kind.description() + ": " + detail;
  }
}
