package dev.memvid.searcher;

import java.util.List;

/**
 * Result of {@link Searcher#search}.
 *
 * @param hits results ordered by score descending, at most the requested top-k
 * @param totalHits number of matches found, never less than {@code hits.size()}
 * @param tookMs wall-clock time spent in the backend
 */
public record SearchResponse(List<SearchResult> hits, int totalHits, int tookMs) {

  public SearchResponse {
    hits = List.copyOf(hits);
    if (totalHits < hits.size()) {
      throw new IllegalArgumentException(
          "totalHits (" + totalHits + ") must not be less than hits (" + hits.size() + ")");
    }
    tookMs = Math.max(0, tookMs);
  }
}
