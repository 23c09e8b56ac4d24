package dev.memvid.searcher;

import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Backend-agnostic search capability. The gRPC layer only ever talks to this interface, so the
 * deterministic {@link MockSearcher} and the index-backed {@link RealSearcher} are
 * interchangeable.
 *
 * <p>Data operations are asynchronous: they return immediately and complete on whatever execution
 * context the backend uses. Failures complete the future exceptionally with a {@link
 * SearcherException}.
 */
public interface Searcher {

  /** Lower bound applied to every requested top-k. */
  int MIN_TOP_K = 1;

  /** Upper bound applied to every requested top-k. */
  int MAX_TOP_K = 20;

  /** Lower bound applied to every requested snippet length. */
  int MIN_SNIPPET_CHARS = 50;

  /** Upper bound applied to every requested snippet length. */
  int MAX_SNIPPET_CHARS = 1000;

  /**
   * Searches the index.
   *
   * @param query natural language query; blank queries fail with {@link
   *     ErrorKind#INVALID_REQUEST}
   * @param topK maximum number of hits, clamped to [{@value #MIN_TOP_K}, {@value #MAX_TOP_K}]
   * @param snippetChars maximum snippet length, clamped to [{@value #MIN_SNIPPET_CHARS}, {@value
   *     #MAX_SNIPPET_CHARS}]
   * @return hits ordered by score descending, ties in dataset order
   */
  CompletableFuture<SearchResponse> search(String query, int topK, int snippetChars);

  /**
   * Answers a question from retrieved evidence.
   *
   * @param request the ask request
   * @return the answer, its evidence and retrieval statistics
   */
  CompletableFuture<AskResponse> ask(AskRequest request);

  /**
   * Looks up the slots of an entity directly, without relevance ranking.
   *
   * @param entity entity name, e.g. {@code __profile__}
   * @param slot a single slot to return, or null for all slots
   * @return the entity state; unknown entities yield {@code found=false}
   */
  CompletableFuture<StateResponse> getState(String entity, @Nullable String slot);

  /** Number of frames in the index, cached when the backend was built. */
  int frameCount();

  /** Path of the backing index file, or a synthetic identifier. */
  String memvidFile();

  /** Best-effort readiness probe. Never blocks; reports false when the backend is busy. */
  boolean isReady();
}
