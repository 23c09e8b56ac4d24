package dev.memvid.index;

import java.util.List;

/**
 * Best search hits.
 *
 * @param hits at most topK hits, best first
 * @param totalHits number of frames that matched
 */
public record IndexSearchResult(List<IndexHit> hits, int totalHits) {

  public IndexSearchResult {
    hits = List.copyOf(hits);
  }
}
