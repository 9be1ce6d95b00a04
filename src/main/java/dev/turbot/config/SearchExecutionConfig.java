package dev.turbot.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runtime collaborators of the search service: the worker pool for blocking search calls (query
 * embedding and vector store lookups) and the clock that times each request.
 *
 * <p>Pool size is read from {@code turbot.search.executor.pool-size}, never below 2.
 */
@Configuration
public class SearchExecutionConfig {

  @Bean(destroyMethod = "shutdown")
  public ExecutorService searchExecutor(
      @Value("${turbot.search.executor.pool-size:4}") int poolSize) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "search-worker-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(Math.max(2, poolSize), threadFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock searchClock() {
    return Clock.systemUTC();
  }
}
