package dev.memvid.searcher;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/** Result-shape invariants of {@link MockSearcher#search} over arbitrary queries and limits. */
class MockSearcherPropertyTest {

  private final MockSearcher searcher = new MockSearcher();

  @Provide
  Arbitrary<String> queries() {
    return Arbitraries.oneOf(
        Arbitraries.strings().alpha().numeric().withChars(' ', '-').ofMinLength(1).ofMaxLength(40)
            .filter(s -> !s.isBlank()),
        Arbitraries.of("leadership", "java", "security", "machine learning", "education"));
  }

  @Property
  void hit_count_is_clamped_top_k_bounded_by_dataset(
      @ForAll("queries") String query, @ForAll @IntRange(min = -10, max = 50) int topK) {
    List<SearchResult> hits = searcher.search(query, topK, 200).join().hits();

    int expected = Math.min(Math.max(1, Math.min(20, topK)), MockSearcher.DATASET.size());
    assertThat(hits).hasSize(expected);
  }

  @Property
  void hits_are_sorted_and_scores_bounded(@ForAll("queries") String query) {
    List<SearchResult> hits = searcher.search(query, 20, 200).join().hits();

    for (int i = 1; i < hits.size(); i++) {
      assertThat(hits.get(i - 1).score()).isGreaterThanOrEqualTo(hits.get(i).score());
    }
    assertThat(hits)
        .allSatisfy(hit -> assertThat(hit.score()).isGreaterThan(0.0f).isLessThanOrEqualTo(1.0f));
  }

  @Property
  void snippets_never_exceed_clamped_length(
      @ForAll("queries") String query, @ForAll @IntRange(min = 0, max = 2000) int snippetChars) {
    int limit = Math.max(50, Math.min(1000, snippetChars));

    assertThat(searcher.search(query, 20, snippetChars).join().hits())
        .allSatisfy(
            hit ->
                assertThat(hit.snippet().codePointCount(0, hit.snippet().length()))
                    .isLessThanOrEqualTo(limit));
  }

  @Property
  void total_hits_is_never_below_returned_hits(@ForAll("queries") String query) {
    SearchResponse response = searcher.search(query, 5, 200).join();

    assertThat(response.totalHits()).isGreaterThanOrEqualTo(response.hits().size());
  }
}
