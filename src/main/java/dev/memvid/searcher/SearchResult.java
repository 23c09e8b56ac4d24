package dev.memvid.searcher;

import java.util.List;

/**
 * A single hit returned by a {@link Searcher}.
 *
 * @param title heading of the matched section, never an internal frame identifier
 * @param score relevance score; backends aim for [0, 1] but callers must not rely on it
 * @param snippet matched text, truncated to the caller's snippet length
 * @param tags ordered tags attached to the matched section
 */
public record SearchResult(String title, float score, String snippet, List<String> tags) {

  public SearchResult {
    tags = List.copyOf(tags);
  }
}
