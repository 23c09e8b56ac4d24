package dev.memvid.searcher;

/** Retrieval strategy used by {@link Searcher#ask}. */
public enum AskMode {
  /** Lexical and semantic retrieval fused into one ranking. */
  HYBRID,
  /** Embedding similarity only. */
  SEMANTIC,
  /** Term matching only. */
  LEXICAL
}
