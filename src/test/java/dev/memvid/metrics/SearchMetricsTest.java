package dev.memvid.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.distribution.CountAtBucket;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SearchMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final SearchMetrics metrics = new SearchMetrics(registry);

  @Test
  void successful_search_records_latency_and_count() {
    metrics.recordSearch(12.5);
    metrics.recordSearch(3.0);

    assertThat(registry.get(SearchMetrics.SEARCHES).counter().count()).isEqualTo(2.0);
    assertThat(registry.get(SearchMetrics.LATENCY).summary().count()).isEqualTo(2);
    assertThat(registry.get(SearchMetrics.LATENCY).summary().totalAmount()).isEqualTo(15.5);
    assertThat(registry.get(SearchMetrics.ERRORS).counter().count()).isZero();
  }

  @Test
  void errors_are_counted_separately() {
    metrics.recordError();

    assertThat(registry.get(SearchMetrics.ERRORS).counter().count()).isEqualTo(1.0);
    assertThat(registry.get(SearchMetrics.SEARCHES).counter().count()).isZero();
  }

  @Test
  void latency_is_a_bucketed_histogram() {
    metrics.recordSearch(7.0);

    CountAtBucket[] buckets =
        registry.get(SearchMetrics.LATENCY).summary().takeSnapshot().histogramCounts();

    assertThat(buckets).isNotEmpty();
    assertThat(Arrays.stream(buckets).filter(bucket -> bucket.bucket() == 10.0))
        .singleElement()
        .satisfies(bucket -> assertThat(bucket.count()).isEqualTo(1.0));
  }
}
