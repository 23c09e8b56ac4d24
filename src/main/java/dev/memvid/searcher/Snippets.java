package dev.memvid.searcher;

/** Snippet truncation shared by both backends so hits look the same regardless of source. */
final class Snippets {

  static final String TRUNCATION_MARKER = "...";

  private Snippets() {}

  /**
   * Truncates text to at most {@code maxChars} code points. When cut, the last three code points
   * are replaced with {@value #TRUNCATION_MARKER}, so the result never exceeds {@code maxChars}.
   */
  static String truncate(String text, int maxChars) {
    if (text.codePointCount(0, text.length()) <= maxChars) {
      return text;
    }
    int keep = Math.max(0, maxChars - TRUNCATION_MARKER.length());
    return text.substring(0, text.offsetByCodePoints(0, keep)) + TRUNCATION_MARKER;
  }
}
