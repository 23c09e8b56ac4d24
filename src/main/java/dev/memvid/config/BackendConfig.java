package dev.memvid.config;

import dev.memvid.index.MemvidIndexLoader;
import dev.memvid.searcher.MockSearcher;
import dev.memvid.searcher.RealSearcher;
import dev.memvid.searcher.Searcher;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the backend at startup: the deterministic {@link MockSearcher} in mock mode, otherwise a
 * {@link RealSearcher} over the configured index file.
 *
 * <p>A real backend that cannot be opened fails the context. There is no fallback to the mock.
 */
@Configuration
public class BackendConfig {

  private static final Logger log = LoggerFactory.getLogger(BackendConfig.class);

  static final String BLOCKING_THREAD_PREFIX = "memvid-blocking-";

  /** Bounded pool running the index open and every index call. */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService memvidBlockingExecutor(MemvidProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getBlockingThreads(), blockingThreadFactory());
  }

  @Bean
  public Searcher searcher(
      MemvidProperties properties,
      ObjectProvider<MemvidIndexLoader> indexLoader,
      ExecutorService memvidBlockingExecutor) {
    if (properties.isMock()) {
      log.info("Mock mode enabled: serving the sample dataset");
      return new MockSearcher();
    }
    log.info("Loading real memvid backend from {}", properties.getFilePath());
    return openRealSearcher(
        Path.of(properties.getFilePath()), indexLoader.getObject(), memvidBlockingExecutor);
  }

  static Searcher openRealSearcher(
      Path filePath, MemvidIndexLoader loader, ExecutorService blockingExecutor) {
    try {
      return RealSearcher.open(filePath, loader, blockingExecutor).join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.error(
          "FATAL: Failed to load memvid file {}. Set MOCK_MEMVID=true for testing. Cause: {}",
          filePath,
          cause.getMessage());
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Failed to load memvid file " + filePath, cause);
    }
  }

  static ThreadFactory blockingThreadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, BLOCKING_THREAD_PREFIX + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
