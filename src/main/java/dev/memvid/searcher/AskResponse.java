package dev.memvid.searcher;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of {@link Searcher#ask}.
 *
 * @param answer synthesized answer, or the concatenated evidence when no synthesis was requested
 * @param evidence evidence fragments ordered by score descending
 * @param stats retrieval statistics
 */
public record AskResponse(String answer, List<SearchResult> evidence, AskStats stats) {

  public AskResponse {
    evidence = List.copyOf(evidence);
  }

  /**
   * Builds the context-only answer: one {@code **title**} block per evidence entry followed by
   * its snippet, blocks separated by a blank line.
   */
  static String contextAnswer(List<SearchResult> evidence) {
    return evidence.stream()
        .map(e -> "**" + e.title() + "**\n" + e.snippet())
        .collect(Collectors.joining("\n\n"));
  }
}
