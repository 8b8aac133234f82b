package dev.scriptorium.search;

import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds a {@link ScoringModel} that is created on first use.
 *
 * <p>Creation happens at most once per successful load: concurrent first callers block on a lock
 * until the first one finishes and then share its instance. A failed load is not remembered, so
 * the next caller tries again. Once loaded the model is shared read-only by all callers.
 */
public class LazyScoringModel implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(LazyScoringModel.class);

  private final Supplier<? extends ScoringModel> factory;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile @Nullable ScoringModel model;

  public LazyScoringModel(Supplier<? extends ScoringModel> factory) {
    this.factory = Objects.requireNonNull(factory, "factory must not be null");
  }

  /**
   * Returns the model, loading it if this is the first call.
   *
   * @throws RuntimeException whatever the factory throws when loading fails
   */
  public ScoringModel get() {
    ScoringModel loaded = model;
    if (loaded != null) {
      return loaded;
    }
    lock.lock();
    try {
      loaded = model;
      if (loaded == null) {
        long start = System.nanoTime();
        loaded = Objects.requireNonNull(factory.get(), "scoring model factory returned null");
        model = loaded;
        log.info(
            "Reranker model loaded in {} ms",
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      }
      return loaded;
    } finally {
      lock.unlock();
    }
  }

  public boolean isLoaded() {
    return model != null;
  }

  @Override
  public void close() throws Exception {
    lock.lock();
    try {
      ScoringModel loaded = model;
      model = null;
      if (loaded instanceof AutoCloseable closeable) {
        closeable.close();
      }
    } finally {
      lock.unlock();
    }
  }
}
