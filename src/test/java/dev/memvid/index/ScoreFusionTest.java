package dev.memvid.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScoreFusionTest {

  private static final double ALPHA = ScoreFusion.DEFAULT_ALPHA;

  @Test
  void empty_inputs_return_empty_result() {
    assertThat(ScoreFusion.fuse(Map.of(), Map.of(), ALPHA)).isEmpty();
  }

  @Test
  void single_semantic_hit_scores_alpha() {
    Map<Long, Double> fused = ScoreFusion.fuse(Map.of(1L, 0.85), Map.of(), ALPHA);

    // a single score normalises to 1.0
    assertThat(fused.get(1L)).isCloseTo(ALPHA, within(1e-9));
  }

  @Test
  void single_lexical_hit_scores_one_minus_alpha() {
    Map<Long, Double> fused = ScoreFusion.fuse(Map.of(), Map.of(2L, 3.5), ALPHA);

    assertThat(fused.get(2L)).isCloseTo(1.0 - ALPHA, within(1e-9));
  }

  @Test
  void frame_found_by_both_legs_sums_contributions() {
    Map<Long, Double> fused = ScoreFusion.fuse(Map.of(7L, 0.9), Map.of(7L, 4.0), ALPHA);

    assertThat(fused).containsOnlyKeys(7L);
    assertThat(fused.get(7L)).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void scores_are_min_max_normalised_per_leg() {
    Map<Long, Double> semantic = new LinkedHashMap<>();
    semantic.put(1L, 0.9);
    semantic.put(2L, 0.7);
    semantic.put(3L, 0.8);
    Map<Long, Double> lexical = new LinkedHashMap<>();
    lexical.put(2L, 5.0);
    lexical.put(4L, 3.0);

    Map<Long, Double> fused = ScoreFusion.fuse(semantic, lexical, ALPHA);

    assertThat(fused.get(1L)).isCloseTo(0.7, within(1e-9));
    assertThat(fused.get(2L)).isCloseTo(0.3, within(1e-9));
    assertThat(fused.get(3L)).isCloseTo(0.35, within(1e-9));
    assertThat(fused.get(4L)).isCloseTo(0.0, within(1e-9));
  }

  @Test
  void semantic_hits_come_first_in_result_order() {
    Map<Long, Double> fused = ScoreFusion.fuse(Map.of(5L, 0.9), Map.of(6L, 2.0), ALPHA);

    assertThat(fused.keySet()).containsExactly(5L, 6L);
  }

  @Test
  void alpha_outside_unit_interval_is_rejected() {
    assertThatThrownBy(() -> ScoreFusion.fuse(Map.of(), Map.of(), 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
