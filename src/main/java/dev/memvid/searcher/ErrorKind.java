package dev.memvid.searcher;

/** Failure taxonomy shared by every {@link Searcher} implementation. */
public enum ErrorKind {
  /** The configured data source path does not exist. */
  NOT_FOUND("Memvid file not found"),
  /** The data source exists but cannot be opened or parsed. */
  LOAD_FAILURE("Failed to load memvid index"),
  /** The backend failed while executing a query. */
  SEARCH_FAILURE("Search failed"),
  /** Caller input failed validation. */
  INVALID_REQUEST("Invalid request"),
  /** The backend cannot serve yet. */
  NOT_READY("Service not ready"),
  /** Unexpected failure such as task scheduling. */
  INTERNAL("Internal error");

  private final String description;

  ErrorKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
