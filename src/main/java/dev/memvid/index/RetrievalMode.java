package dev.memvid.index;

/** Retrieval strategies understood by a {@link MemvidIndex}. */
public enum RetrievalMode {
  HYBRID,
  SEMANTIC,
  LEXICAL
}
