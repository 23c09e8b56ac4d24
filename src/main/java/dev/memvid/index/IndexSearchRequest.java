package dev.memvid.index;

/**
 * Search request understood by a {@link MemvidIndex}.
 *
 * @param query query text
 * @param topK maximum number of hits
 */
public record IndexSearchRequest(String query, int topK) {}
