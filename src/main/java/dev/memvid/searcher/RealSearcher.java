package dev.memvid.searcher;

import dev.memvid.index.IndexAskRequest;
import dev.memvid.index.IndexAskResult;
import dev.memvid.index.IndexHit;
import dev.memvid.index.IndexSearchRequest;
import dev.memvid.index.IndexSearchResult;
import dev.memvid.index.MemoryCard;
import dev.memvid.index.MemvidIndex;
import dev.memvid.index.MemvidIndexLoader;
import dev.memvid.index.RetrievalMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Searcher} backed by one shared {@link MemvidIndex}.
 *
 * <p>The index is synchronous and mutates internal state on search and ask, so every call runs on
 * the dedicated blocking executor under a single {@link ReentrantReadWriteLock}:
 *
 * <ul>
 *   <li>search and ask take the write lock
 *   <li>state lookups take the read lock only when {@link MemvidIndex#supportsConcurrentReads()}
 *       says so, otherwise the write lock
 * </ul>
 *
 * <p>Callers never block: each operation returns a future completed by the blocking executor.
 * In-flight index calls cannot be cancelled and run to completion even if the caller gives up.
 */
public final class RealSearcher implements Searcher {

  private static final Logger log = LoggerFactory.getLogger(RealSearcher.class);

  private final Path filePath;
  private final MemvidIndex index;
  private final Executor blockingExecutor;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final int frameCount;

  private RealSearcher(Path filePath, MemvidIndex index, Executor blockingExecutor) {
    this.filePath = filePath;
    this.index = index;
    this.blockingExecutor = blockingExecutor;
    this.frameCount = index.frameCount();
  }

  /**
   * Opens the index file on the blocking executor.
   *
   * @param filePath index file to open
   * @param loader opens the file into a {@link MemvidIndex}
   * @param blockingExecutor executor for the open call and all later index calls
   * @return a future failing with {@link ErrorKind#NOT_FOUND} when the file does not exist and
   *     with {@link ErrorKind#LOAD_FAILURE} when it cannot be opened
   */
  public static CompletableFuture<RealSearcher> open(
      Path filePath, MemvidIndexLoader loader, Executor blockingExecutor) {
    log.info("Loading memvid file {}", filePath);

    if (!Files.exists(filePath)) {
      log.error("Memvid file not found: {}", filePath);
      return CompletableFuture.failedFuture(SearcherException.notFound(filePath.toString()));
    }

    return offload(
            blockingExecutor,
            () -> {
              try {
                return loader.open(filePath);
              } catch (IOException | RuntimeException e) {
                log.error("Failed to open memvid file {}: {}", filePath, e.getMessage());
                throw SearcherException.loadFailure(String.valueOf(e.getMessage()), e);
              }
            })
        .thenApply(
            index -> {
              RealSearcher searcher = new RealSearcher(filePath, index, blockingExecutor);
              log.info(
                  "Memvid file loaded: path={}, frameCount={}", filePath, searcher.frameCount);
              return searcher;
            });
  }

  @Override
  public CompletableFuture<SearchResponse> search(String query, int topK, int snippetChars) {
    try {
      RequestLimits.requireText(query, "Query");
    } catch (SearcherException e) {
      return CompletableFuture.failedFuture(e);
    }
    int clampedTopK = RequestLimits.clampTopK(topK);
    int clampedSnippetChars = RequestLimits.clampSnippetChars(snippetChars);
    IndexSearchRequest request = new IndexSearchRequest(query, clampedTopK);

    log.info("Performing memvid search: query='{}', topK={}", query, clampedTopK);
    long startNanos = System.nanoTime();

    return offload(
            blockingExecutor,
            () -> withLock(lock.writeLock(), "Search", () -> index.search(request)))
        .thenApply(
            result -> {
              List<SearchResult> hits = toSearchResults(result, clampedTopK, clampedSnippetChars);
              int totalHits = Math.max(result.totalHits(), hits.size());
              int tookMs = elapsedMs(startNanos);
              log.info("Memvid search completed: hits={}, tookMs={}", hits.size(), tookMs);
              return new SearchResponse(hits, totalHits, tookMs);
            });
  }

  @Override
  public CompletableFuture<AskResponse> ask(AskRequest request) {
    try {
      RequestLimits.requireText(request.question(), "Question");
    } catch (SearcherException e) {
      return CompletableFuture.failedFuture(e);
    }
    int topK = RequestLimits.clampTopK(request.topK());
    int snippetChars = RequestLimits.clampSnippetChars(request.snippetChars());
    IndexAskRequest indexRequest = toIndexRequest(request, topK);

    log.info(
        "Performing memvid ask: question='{}', mode={}, topK={}",
        request.question(),
        request.mode(),
        topK);
    long startNanos = System.nanoTime();

    return offload(
            blockingExecutor,
            () -> withLock(lock.writeLock(), "Ask", () -> index.ask(indexRequest)))
        .thenApply(
            result -> {
              List<SearchResult> evidence =
                  result.fragments().stream()
                      .limit(topK)
                      .map(hit -> toSearchResult(hit, snippetChars))
                      .toList();
              String answer =
                  request.useLlm() && result.answer() != null
                      ? result.answer()
                      : AskResponse.contextAnswer(evidence);
              AskStats stats =
                  new AskStats(
                      Math.max(result.candidatesRetrieved(), evidence.size()),
                      evidence.size(),
                      (int) result.retrievalMs(),
                      (int) result.rerankingMs(),
                      result.usedFallback());
              log.info(
                  "Memvid ask completed: evidence={}, tookMs={}",
                  evidence.size(),
                  elapsedMs(startNanos));
              return new AskResponse(answer, evidence, stats);
            });
  }

  @Override
  public CompletableFuture<StateResponse> getState(String entity, @Nullable String slot) {
    log.info("Performing memvid state lookup: entity='{}', slot={}", entity, slot);
    Lock stateLock = index.supportsConcurrentReads() ? lock.readLock() : lock.writeLock();

    return offload(
            blockingExecutor,
            () -> withLock(stateLock, "State lookup", () -> index.entityMemories(entity)))
        .thenApply(
            cards -> {
              if (cards.isEmpty()) {
                log.info("Entity '{}' not found in memory cards", entity);
                return StateResponse.notFound(entity);
              }
              Map<String, String> slots = new LinkedHashMap<>();
              for (MemoryCard card : cards) {
                if (slot == null || slot.equals(card.slot())) {
                  slots.put(card.slot(), card.value());
                }
              }
              log.info("State lookup completed: entity='{}', slots={}", entity, slots.size());
              return new StateResponse(true, entity, slots);
            });
  }

  @Override
  public int frameCount() {
    return frameCount;
  }

  @Override
  public String memvidFile() {
    return filePath.toString();
  }

  @Override
  public boolean isReady() {
    Lock readLock = lock.readLock();
    if (readLock.tryLock()) {
      readLock.unlock();
      return true;
    }
    return false;
  }

  private static IndexAskRequest toIndexRequest(AskRequest request, int topK) {
    return new IndexAskRequest(
        request.question(),
        topK,
        toRetrievalMode(request.mode()),
        request.start() > 0 ? request.start() : null,
        request.end() > 0 ? request.end() : null,
        !request.useLlm(),
        request.uri(),
        RequestLimits.scopeExpression(request.filters()),
        request.cursor(),
        request.asOfFrame(),
        request.asOfTs(),
        Boolean.TRUE.equals(request.adaptive()));
  }

  static RetrievalMode toRetrievalMode(AskMode mode) {
    return switch (mode) {
      case HYBRID -> RetrievalMode.HYBRID;
      case SEMANTIC -> RetrievalMode.SEMANTIC;
      case LEXICAL -> RetrievalMode.LEXICAL;
    };
  }

  private static List<SearchResult> toSearchResults(
      IndexSearchResult result, int topK, int snippetChars) {
    return result.hits().stream()
        .limit(topK)
        .map(hit -> toSearchResult(hit, snippetChars))
        .toList();
  }

  static SearchResult toSearchResult(IndexHit hit, int snippetChars) {
    return new SearchResult(
        title(hit),
        hit.score() != null ? hit.score() : 0.0f,
        Snippets.truncate(hit.text(), snippetChars),
        hit.tags());
  }

  /** Explicit title, else first label, else empty. Never exposes the internal frame id. */
  static String title(IndexHit hit) {
    if (hit.title() != null && !hit.title().isBlank()) {
      return hit.title();
    }
    if (!hit.labels().isEmpty()) {
      return hit.labels().get(0);
    }
    return "";
  }

  private static <T> T withLock(Lock heldLock, String operation, Supplier<T> call) {
    heldLock.lock();
    try {
      return call.get();
    } catch (SearcherException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      log.warn("{} rejected by memvid index: {}", operation, e.getMessage());
      throw SearcherException.invalidRequest(String.valueOf(e.getMessage()));
    } catch (RuntimeException e) {
      log.error("{} failed in memvid index: {}", operation, e.getMessage(), e);
      throw SearcherException.searchFailure(operation + " error: " + e.getMessage(), e);
    } finally {
      heldLock.unlock();
    }
  }

  private static <T> CompletableFuture<T> offload(Executor executor, Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, executor);
    } catch (RejectedExecutionException e) {
      log.error("Blocking executor rejected memvid task: {}", e.getMessage());
      return CompletableFuture.failedFuture(
          SearcherException.internal("Task error: " + e.getMessage(), e));
    }
  }

  private static int elapsedMs(long startNanos) {
    return (int) ((System.nanoTime() - startNanos) / 1_000_000);
  }
}
