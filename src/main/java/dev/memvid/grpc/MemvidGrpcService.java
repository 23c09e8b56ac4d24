package dev.memvid.grpc;

import dev.memvid.metrics.SearchMetrics;
import dev.memvid.proto.v1.MemvidProto;
import dev.memvid.proto.v1.MemvidServiceGrpc;
import dev.memvid.searcher.AskMode;
import dev.memvid.searcher.AskRequest;
import dev.memvid.searcher.AskResponse;
import dev.memvid.searcher.AskStats;
import dev.memvid.searcher.SearchResponse;
import dev.memvid.searcher.SearchResult;
import dev.memvid.searcher.Searcher;
import dev.memvid.searcher.StateResponse;
import io.grpc.stub.StreamObserver;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * gRPC adapter for {@code MemvidService}: fills in request defaults, calls the {@link Searcher}
 * and maps results or failures back to the wire.
 *
 * <p>Handlers never block. Responses are written from whichever thread completes the backend
 * future.
 */
@Component
public class MemvidGrpcService extends MemvidServiceGrpc.MemvidServiceImplBase {

  private static final Logger log = LoggerFactory.getLogger(MemvidGrpcService.class);

  static final int DEFAULT_TOP_K = 5;
  static final int DEFAULT_SNIPPET_CHARS = 200;

  private final Searcher searcher;
  private final SearchMetrics metrics;

  public MemvidGrpcService(Searcher searcher, SearchMetrics metrics) {
    this.searcher = searcher;
    this.metrics = metrics;
  }

  @Override
  public void search(
      MemvidProto.SearchRequest request,
      StreamObserver<MemvidProto.SearchResponse> responseObserver) {
    int topK = orDefault(request.getTopK(), DEFAULT_TOP_K);
    int snippetChars = orDefault(request.getSnippetChars(), DEFAULT_SNIPPET_CHARS);
    log.debug("Search request: query='{}', topK={}", request.getQuery(), topK);
    long startNanos = System.nanoTime();

    searcher
        .search(request.getQuery(), topK, snippetChars)
        .whenComplete(
            (response, failure) -> {
              if (failure != null) {
                metrics.recordError();
                log.warn("Search failed: {}", failure.getMessage());
                responseObserver.onError(GrpcStatusMapper.toStatusException(failure));
                return;
              }
              metrics.recordSearch((System.nanoTime() - startNanos) / 1_000_000.0);
              reply(responseObserver, () -> toProto(response));
            });
  }

  @Override
  public void ask(
      MemvidProto.AskRequest request, StreamObserver<MemvidProto.AskResponse> responseObserver) {
    AskRequest askRequest = toAskRequest(request);
    log.debug(
        "Ask request: question='{}', mode={}, topK={}",
        askRequest.question(),
        askRequest.mode(),
        askRequest.topK());

    searcher
        .ask(askRequest)
        .whenComplete(
            (response, failure) -> {
              if (failure != null) {
                log.warn("Ask failed: {}", failure.getMessage());
                responseObserver.onError(GrpcStatusMapper.toStatusException(failure));
                return;
              }
              reply(responseObserver, () -> toProto(response));
            });
  }

  @Override
  public void getState(
      MemvidProto.GetStateRequest request,
      StreamObserver<MemvidProto.GetStateResponse> responseObserver) {
    String slot = emptyToNull(request.getSlot());
    log.debug("GetState request: entity='{}', slot={}", request.getEntity(), slot);

    searcher
        .getState(request.getEntity(), slot)
        .whenComplete(
            (response, failure) -> {
              if (failure != null) {
                log.warn("GetState failed: {}", failure.getMessage());
                responseObserver.onError(GrpcStatusMapper.toStatusException(failure));
                return;
              }
              reply(responseObserver, () -> toProto(response));
            });
  }

  static AskRequest toAskRequest(MemvidProto.AskRequest request) {
    return AskRequest.builder(request.getQuestion())
        .useLlm(request.getUseLlm())
        .topK(orDefault(request.getTopK(), DEFAULT_TOP_K))
        .filters(request.getFiltersMap())
        .timeRange(request.getStart(), request.getEnd())
        .snippetChars(orDefault(request.getSnippetChars(), DEFAULT_SNIPPET_CHARS))
        .mode(toAskMode(request.getModeValue()))
        .uri(emptyToNull(request.getUri()))
        .cursor(emptyToNull(request.getCursor()))
        .asOfFrame(request.hasAsOfFrame() ? request.getAsOfFrame() : null)
        .asOfTs(request.hasAsOfTs() ? request.getAsOfTs() : null)
        .adaptive(request.hasAdaptive() ? request.getAdaptive() : null)
        .build();
  }

  /** Unrecognized wire values select hybrid retrieval. */
  static AskMode toAskMode(int wireValue) {
    return switch (wireValue) {
      case MemvidProto.AskMode.ASK_MODE_SEM_VALUE -> AskMode.SEMANTIC;
      case MemvidProto.AskMode.ASK_MODE_LEX_VALUE -> AskMode.LEXICAL;
      default -> AskMode.HYBRID;
    };
  }

  /** Sends the mapped response, or INTERNAL when mapping fails, so the call always closes. */
  private static <T> void reply(StreamObserver<T> responseObserver, Supplier<T> mapping) {
    T message;
    try {
      message = mapping.get();
    } catch (RuntimeException e) {
      log.error("Failed to build response: {}", e.getMessage(), e);
      responseObserver.onError(GrpcStatusMapper.toStatusException(e));
      return;
    }
    responseObserver.onNext(message);
    responseObserver.onCompleted();
  }

  private static MemvidProto.SearchResponse toProto(SearchResponse response) {
    return MemvidProto.SearchResponse.newBuilder()
        .addAllHits(toProto(response.hits()))
        .setTotalHits(response.totalHits())
        .setTookMs(response.tookMs())
        .build();
  }

  private static MemvidProto.AskResponse toProto(AskResponse response) {
    AskStats stats = response.stats();
    return MemvidProto.AskResponse.newBuilder()
        .setAnswer(response.answer())
        .addAllEvidence(toProto(response.evidence()))
        .setStats(
            MemvidProto.AskStats.newBuilder()
                .setCandidatesRetrieved(stats.candidatesRetrieved())
                .setResultsReturned(stats.resultsReturned())
                .setRetrievalMs(stats.retrievalMs())
                .setRerankingMs(stats.rerankingMs())
                .setUsedFallback(stats.usedFallback()))
        .build();
  }

  private static MemvidProto.GetStateResponse toProto(StateResponse response) {
    return MemvidProto.GetStateResponse.newBuilder()
        .setFound(response.found())
        .setEntity(response.entity())
        .putAllSlots(response.slots())
        .build();
  }

  private static List<MemvidProto.SearchHit> toProto(List<SearchResult> results) {
    return results.stream()
        .map(
            result ->
                MemvidProto.SearchHit.newBuilder()
                    .setTitle(result.title())
                    .setScore(result.score())
                    .setSnippet(result.snippet())
                    .addAllTags(result.tags())
                    .build())
        .toList();
  }

  private static int orDefault(int value, int defaultValue) {
    return value == 0 ? defaultValue : value;
  }

  private static @Nullable String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }
}
