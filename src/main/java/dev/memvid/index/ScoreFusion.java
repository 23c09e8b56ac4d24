package dev.memvid.index;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convex combination of semantic and lexical scores.
 *
 * <p>Each source is min-max normalised to [0, 1] independently, then combined per frame as
 * {@code alpha * semantic + (1 - alpha) * lexical}. A frame found by only one source gets 0.0 for
 * the other.
 */
final class ScoreFusion {

  /** Weight of the semantic leg in hybrid retrieval. */
  static final double DEFAULT_ALPHA = 0.7;

  private ScoreFusion() {}

  /**
   * Fuses two score maps keyed by frame id.
   *
   * @param semantic semantic scores
   * @param lexical lexical scores
   * @param alpha weight for semantic scores (0.0 = lexical only, 1.0 = semantic only)
   * @return combined scores, semantic hits first then lexical-only hits, unsorted
   */
  static Map<Long, Double> fuse(
      Map<Long, Double> semantic, Map<Long, Double> lexical, double alpha) {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
    }
    Map<Long, Double> fused = new LinkedHashMap<>();
    Bounds semanticBounds = Bounds.of(semantic);
    Bounds lexicalBounds = Bounds.of(lexical);

    semantic.forEach((id, score) -> fused.put(id, alpha * semanticBounds.normalise(score)));
    lexical.forEach(
        (id, score) ->
            fused.merge(id, (1.0 - alpha) * lexicalBounds.normalise(score), Double::sum));
    return fused;
  }

  private record Bounds(double min, double max) {

    static Bounds of(Map<Long, Double> scores) {
      double min = scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
      double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
      return new Bounds(min, max);
    }

    /** If all scores are identical they normalise to 1.0. */
    double normalise(double score) {
      if (max == min) {
        return 1.0;
      }
      return (score - min) / (max - min);
    }
  }
}
