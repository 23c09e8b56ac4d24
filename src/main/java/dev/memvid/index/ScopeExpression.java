package dev.memvid.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Parsed scope expression: whitespace-separated {@code key:value} terms, all of which must match.
 *
 * <p>{@code label:} and {@code tag:} terms match a frame's labels and tags, {@code uri:} matches
 * the frame URI, any other key matches the frame metadata. Values compare case-insensitively and
 * cannot contain whitespace.
 */
final class ScopeExpression implements Predicate<IndexFile.Frame> {

  private static final ScopeExpression EMPTY = new ScopeExpression(List.of());

  private final List<Term> terms;

  private ScopeExpression(List<Term> terms) {
    this.terms = terms;
  }

  /**
   * Parses an expression. Null or blank yields an expression matching every frame.
   *
   * @throws IllegalArgumentException if a term has no {@code :} or an empty key or value
   */
  static ScopeExpression parse(@Nullable String expression) {
    if (expression == null || expression.isBlank()) {
      return EMPTY;
    }
    List<Term> terms = new ArrayList<>();
    for (String token : expression.trim().split("\\s+")) {
      int colon = token.indexOf(':');
      if (colon <= 0 || colon == token.length() - 1) {
        throw new IllegalArgumentException("Malformed scope term: '" + token + "'");
      }
      terms.add(
          new Term(
              token.substring(0, colon).toLowerCase(Locale.ROOT), token.substring(colon + 1)));
    }
    return new ScopeExpression(List.copyOf(terms));
  }

  @Override
  public boolean test(IndexFile.Frame frame) {
    return terms.stream().allMatch(term -> term.matches(frame));
  }

  private record Term(String key, String value) {

    boolean matches(IndexFile.Frame frame) {
      return switch (key) {
        case "label", "labels" -> containsIgnoreCase(frame.labels(), value);
        case "tag", "tags" -> containsIgnoreCase(frame.tags(), value);
        case "uri" -> value.equals(frame.uri());
        default -> value.equalsIgnoreCase(frame.metadata().get(key));
      };
    }

    private static boolean containsIgnoreCase(List<String> values, String wanted) {
      return values.stream().anyMatch(wanted::equalsIgnoreCase);
    }
  }
}
