package dev.memvid.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Search metrics, exported by the Prometheus registry as {@code memvid_search_latency_ms},
 * {@code memvid_search_total} and {@code memvid_search_errors_total}.
 */
@Component
public class SearchMetrics {

  static final String LATENCY = "memvid.search.latency.ms";
  static final String SEARCHES = "memvid.search";
  static final String ERRORS = "memvid.search.errors";

  private final DistributionSummary latency;
  private final Counter searches;
  private final Counter errors;

  public SearchMetrics(MeterRegistry registry) {
    this.latency =
        DistributionSummary.builder(LATENCY)
            .description("Time taken for memvid search operations in milliseconds")
            .serviceLevelObjectives(1, 5, 10, 25, 50, 100, 250, 500, 1000, 2500, 5000)
            .register(registry);
    this.searches =
        Counter.builder(SEARCHES)
            .description("Total number of search requests processed")
            .register(registry);
    this.errors =
        Counter.builder(ERRORS).description("Total number of search errors").register(registry);
  }

  /** Records one successful search. */
  public void recordSearch(double latencyMs) {
    latency.record(latencyMs);
    searches.increment();
  }

  public void recordError() {
    errors.increment();
  }
}
