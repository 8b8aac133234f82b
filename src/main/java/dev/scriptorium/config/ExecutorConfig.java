package dev.scriptorium.config;

import dev.scriptorium.search.SearchProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Worker threads for the retrieval channels and reranking. */
@Configuration
public class ExecutorConfig {

  /**
   * Fixed pool running vector search, keyword search and reranker batches off the request thread.
   * Sized by {@code scriptorium.search.executor-threads}.
   */
  @Bean(name = "searchExecutor", destroyMethod = "shutdown")
  public ExecutorService searchExecutor(SearchProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        properties.getExecutorThreads(),
        runnable -> {
          Thread thread = new Thread(runnable, "search-exec-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
