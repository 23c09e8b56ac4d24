package dev.memvid.searcher;

/**
 * Observational statistics about an ask call. Never used for control flow.
 *
 * @param candidatesRetrieved candidates considered before paging and cut-off
 * @param resultsReturned evidence entries in the response
 * @param retrievalMs time spent retrieving candidates
 * @param rerankingMs time spent fusing or re-ranking candidates
 * @param usedFallback whether the backend fell back from the requested retrieval strategy
 */
public record AskStats(
    int candidatesRetrieved,
    int resultsReturned,
    int retrievalMs,
    int rerankingMs,
    boolean usedFallback) {}
