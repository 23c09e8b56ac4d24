package dev.memvid.index;

import java.util.List;

/**
 * An opened memvid index.
 *
 * <p>Implementations are synchronous and <b>not</b> thread-safe: search and ask may update
 * internal caches and cursors. Callers must serialize access themselves.
 */
public interface MemvidIndex {

  /**
   * Retrieves frames matching a query.
   *
   * @throws IllegalArgumentException if the request is malformed, e.g. an unreadable cursor
   */
  IndexSearchResult search(IndexSearchRequest request);

  /**
   * Retrieves context fragments for a question and optionally synthesizes an answer.
   *
   * @throws IllegalArgumentException if the request is malformed, e.g. an unreadable cursor
   */
  IndexAskResult ask(IndexAskRequest request);

  /** All memory cards stored for an entity, empty when the entity is unknown. */
  List<MemoryCard> entityMemories(String entity);

  /** Number of frames in the index. */
  int frameCount();

  /**
   * Whether {@link #entityMemories} is a true read-only path that may run concurrently with other
   * calls to it. Search and ask are never safe to run concurrently.
   */
  default boolean supportsConcurrentReads() {
    return false;
  }
}
