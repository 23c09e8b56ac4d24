package dev.memvid.index;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of an ask call.
 *
 * @param answer synthesized answer, null when the index produced none
 * @param fragments context fragments, best first
 * @param candidatesRetrieved candidates considered before paging and cut-off
 * @param retrievalMs time spent retrieving
 * @param rerankingMs time spent fusing scores
 * @param usedFallback whether lexical retrieval replaced an empty semantic leg
 */
public record IndexAskResult(
    @Nullable String answer,
    List<IndexHit> fragments,
    int candidatesRetrieved,
    long retrievalMs,
    long rerankingMs,
    boolean usedFallback) {

  public IndexAskResult {
    fragments = List.copyOf(fragments);
  }
}
