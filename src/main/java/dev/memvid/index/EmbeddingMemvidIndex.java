package dev.memvid.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MemvidIndex} over a JSON index file, with every frame embedded in memory.
 *
 * <p>Retrieval strategies:
 *
 * <ul>
 *   <li>semantic: cosine similarity between the query embedding and each frame, hits below
 *       {@value #MIN_SEMANTIC_SCORE} relevance are dropped
 *   <li>lexical: BM25 over title, text, labels and tags
 *   <li>hybrid: {@link ScoreFusion} of both legs, falling back to lexical when the semantic leg is
 *       empty
 * </ul>
 *
 * <p>Query embeddings are kept in an access-ordered LRU cache, so search and ask mutate state and
 * must not run concurrently. Memory cards are immutable after load.
 */
public final class EmbeddingMemvidIndex implements MemvidIndex {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingMemvidIndex.class);

  static final double MIN_SEMANTIC_SCORE = 0.7;
  static final double ADAPTIVE_CUTOFF = 0.5;
  static final int QUERY_CACHE_SIZE = 256;
  private static final int EMBEDDING_BATCH_SIZE = 64;

  private final List<IndexFile.Frame> frames;
  private final Map<Long, IndexFile.Frame> framesById;
  private final Map<Long, Integer> positions;
  private final Map<String, List<MemoryCard>> cardsByEntity;
  private final EmbeddingModel embeddingModel;
  private final InMemoryEmbeddingStore<TextSegment> store;
  private final LexicalScorer lexicalScorer;
  private final Map<String, Embedding> queryEmbeddings;

  private EmbeddingMemvidIndex(IndexFile file, EmbeddingModel embeddingModel) {
    this.frames = file.frames();
    this.framesById = new HashMap<>();
    this.positions = new HashMap<>();
    for (IndexFile.Frame frame : frames) {
      if (framesById.put(frame.id(), frame) != null) {
        throw new IllegalArgumentException("Duplicate frame id " + frame.id());
      }
      positions.put(frame.id(), positions.size());
    }
    this.cardsByEntity =
        file.memoryCards().stream()
            .collect(
                Collectors.groupingBy(
                    MemoryCard::entity,
                    LinkedHashMap::new,
                    Collectors.collectingAndThen(Collectors.toList(), List::copyOf)));
    this.embeddingModel = embeddingModel;
    this.store = new InMemoryEmbeddingStore<>();
    this.lexicalScorer = new LexicalScorer(frames);
    this.queryEmbeddings =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Embedding> eldest) {
            return size() > QUERY_CACHE_SIZE;
          }
        };
  }

  /**
   * Reads an index file and embeds all of its frames.
   *
   * @throws IOException if the file cannot be read, is not a valid index or has an unsupported
   *     version
   */
  public static EmbeddingMemvidIndex open(
      Path path, EmbeddingModel embeddingModel, ObjectMapper objectMapper) throws IOException {
    long startNanos = System.nanoTime();
    IndexFile file = objectMapper.readValue(path.toFile(), IndexFile.class);
    if (file.version() > IndexFile.CURRENT_VERSION) {
      throw new IOException("Unsupported index version " + file.version() + " in " + path);
    }

    EmbeddingMemvidIndex index;
    try {
      index = new EmbeddingMemvidIndex(file, embeddingModel);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid index file " + path + ": " + e.getMessage(), e);
    }
    index.embedFrames();

    log.info(
        "Opened memvid index {}: frames={}, entities={}, tookMs={}",
        path,
        index.frames.size(),
        index.cardsByEntity.size(),
        (System.nanoTime() - startNanos) / 1_000_000);
    return index;
  }

  /** Loader opening files with the given model and mapper. */
  public static MemvidIndexLoader loader(EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
    return path -> open(path, embeddingModel, objectMapper);
  }

  private void embedFrames() {
    for (int from = 0; from < frames.size(); from += EMBEDDING_BATCH_SIZE) {
      List<IndexFile.Frame> batch =
          frames.subList(from, Math.min(from + EMBEDDING_BATCH_SIZE, frames.size()));
      List<String> ids = new ArrayList<>(batch.size());
      List<TextSegment> segments = new ArrayList<>(batch.size());
      for (IndexFile.Frame frame : batch) {
        ids.add(String.valueOf(frame.id()));
        String text = frame.title() == null ? frame.text() : frame.title() + "\n" + frame.text();
        segments.add(TextSegment.from(text));
      }
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      store.addAll(ids, embeddings, segments);
      log.debug("Embedded frames {}..{}", from, from + batch.size() - 1);
    }
  }

  /** Hybrid retrieval over every frame. */
  @Override
  public IndexSearchResult search(IndexSearchRequest request) {
    Ranking ranking = rank(request.query(), RetrievalMode.HYBRID, frame -> true);
    return new IndexSearchResult(
        page(ranking.scores(), 0, request.topK()), ranking.scores().size());
  }

  @Override
  public IndexAskResult ask(IndexAskRequest request) {
    Predicate<IndexFile.Frame> eligible =
        eligibility(request.uri(), request.scope(), request.asOfFrame(), request.asOfTs())
            .and(withinTimeRange(request.start(), request.end()));
    int offset = PageCursor.decode(request.cursor());
    Ranking ranking = rank(request.question(), request.mode(), eligible);

    List<Map.Entry<Long, Double>> scores = ranking.scores();
    if (request.adaptive() && !scores.isEmpty()) {
      double cutoff = scores.get(0).getValue() * ADAPTIVE_CUTOFF;
      scores = scores.stream().filter(entry -> entry.getValue() >= cutoff).toList();
    }
    if (!request.contextOnly()) {
      log.debug("Answer synthesis is not available, returning context fragments only");
    }
    return new IndexAskResult(
        null,
        page(scores, offset, request.topK()),
        ranking.scores().size(),
        ranking.retrievalMs(),
        ranking.rerankingMs(),
        ranking.usedFallback());
  }

  @Override
  public List<MemoryCard> entityMemories(String entity) {
    return cardsByEntity.getOrDefault(entity, List.of());
  }

  @Override
  public int frameCount() {
    return frames.size();
  }

  /** Memory cards are read-only after load, so state lookups may run concurrently. */
  @Override
  public boolean supportsConcurrentReads() {
    return true;
  }

  private Ranking rank(String query, RetrievalMode mode, Predicate<IndexFile.Frame> eligible) {
    long startNanos = System.nanoTime();
    Map<Long, Double> semantic =
        mode == RetrievalMode.LEXICAL ? Map.of() : retain(semanticScores(query), eligible);
    Map<Long, Double> lexical =
        mode == RetrievalMode.SEMANTIC && !semantic.isEmpty()
            ? Map.of()
            : retain(lexicalScorer.score(query), eligible);
    long retrievalMs = (System.nanoTime() - startNanos) / 1_000_000;

    long fusionNanos = System.nanoTime();
    boolean usedFallback = mode != RetrievalMode.LEXICAL && semantic.isEmpty();
    Map<Long, Double> combined;
    if (usedFallback || mode == RetrievalMode.LEXICAL) {
      if (usedFallback) {
        log.warn("Semantic retrieval found nothing for '{}', falling back to lexical", query);
      }
      combined = lexical;
    } else if (mode == RetrievalMode.SEMANTIC) {
      combined = semantic;
    } else {
      combined = ScoreFusion.fuse(semantic, lexical, ScoreFusion.DEFAULT_ALPHA);
    }
    List<Map.Entry<Long, Double>> sorted = sort(combined);
    long rerankingMs = (System.nanoTime() - fusionNanos) / 1_000_000;

    return new Ranking(sorted, retrievalMs, rerankingMs, usedFallback);
  }

  private Map<Long, Double> semanticScores(String query) {
    Map<Long, Double> scores = new LinkedHashMap<>();
    if (frames.isEmpty()) {
      return scores;
    }
    EmbeddingSearchRequest searchRequest =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding(query))
            .maxResults(frames.size())
            .minScore(MIN_SEMANTIC_SCORE)
            .build();
    for (EmbeddingMatch<TextSegment> match : store.search(searchRequest).matches()) {
      scores.put(Long.parseLong(match.embeddingId()), match.score());
    }
    return scores;
  }

  private Embedding queryEmbedding(String query) {
    Embedding cached = queryEmbeddings.get(query);
    if (cached != null) {
      return cached;
    }
    Embedding embedding = embeddingModel.embed(query).content();
    queryEmbeddings.put(query, embedding);
    return embedding;
  }

  private Map<Long, Double> retain(Map<Long, Double> scores, Predicate<IndexFile.Frame> eligible) {
    Map<Long, Double> retained = new LinkedHashMap<>();
    scores.forEach(
        (id, score) -> {
          if (eligible.test(framesById.get(id))) {
            retained.put(id, score);
          }
        });
    return retained;
  }

  /** Highest score first, ties in frame order. */
  private List<Map.Entry<Long, Double>> sort(Map<Long, Double> scores) {
    Comparator<Map.Entry<Long, Double>> byScore =
        Comparator.comparingDouble(Map.Entry<Long, Double>::getValue).reversed();
    return scores.entrySet().stream()
        .sorted(byScore.thenComparing(entry -> positions.get(entry.getKey())))
        .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
        .toList();
  }

  private List<IndexHit> page(List<Map.Entry<Long, Double>> scores, int offset, int topK) {
    int from = Math.min(offset, scores.size());
    int to = Math.min(from + Math.max(topK, 0), scores.size());
    List<IndexHit> hits = new ArrayList<>(to - from);
    for (Map.Entry<Long, Double> entry : scores.subList(from, to)) {
      IndexFile.Frame frame = framesById.get(entry.getKey());
      hits.add(
          new IndexHit(
              frame.id(),
              frame.uri(),
              frame.title(),
              frame.text(),
              entry.getValue().floatValue(),
              frame.labels(),
              frame.tags()));
    }
    return hits;
  }

  private static Predicate<IndexFile.Frame> eligibility(
      @Nullable String uri,
      @Nullable String scope,
      @Nullable Long asOfFrame,
      @Nullable Long asOfTs) {
    Predicate<IndexFile.Frame> eligible = ScopeExpression.parse(scope);
    if (uri != null) {
      eligible = eligible.and(frame -> uri.equals(frame.uri()));
    }
    if (asOfFrame != null) {
      eligible = eligible.and(frame -> frame.id() <= asOfFrame);
    }
    if (asOfTs != null) {
      eligible = eligible.and(frame -> frame.timestamp() > 0 && frame.timestamp() <= asOfTs);
    }
    return eligible;
  }

  /** Frames without a timestamp never match a bounded range. */
  private static Predicate<IndexFile.Frame> withinTimeRange(
      @Nullable Long start, @Nullable Long end) {
    if (start == null && end == null) {
      return frame -> true;
    }
    return frame ->
        frame.timestamp() > 0
            && (start == null || frame.timestamp() >= start)
            && (end == null || frame.timestamp() <= end);
  }

  private record Ranking(
      List<Map.Entry<Long, Double>> scores,
      long retrievalMs,
      long rerankingMs,
      boolean usedFallback) {}
}
