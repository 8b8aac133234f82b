package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.withSettings;

import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LazyScoringModelTest {

  @Test
  void loadsOnFirstUseOnly() {
    ScoringModel model = mock(ScoringModel.class);
    AtomicInteger loads = new AtomicInteger();
    LazyScoringModel lazy =
        new LazyScoringModel(
            () -> {
              loads.incrementAndGet();
              return model;
            });

    assertThat(lazy.isLoaded()).isFalse();
    assertThat(lazy.get()).isSameAs(model);
    assertThat(lazy.get()).isSameAs(model);
    assertThat(lazy.isLoaded()).isTrue();
    assertThat(loads).hasValue(1);
  }

  @Test
  void failedLoadIsRetriedOnNextCall() {
    ScoringModel model = mock(ScoringModel.class);
    AtomicInteger attempts = new AtomicInteger();
    LazyScoringModel lazy =
        new LazyScoringModel(
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("tokenizer missing");
              }
              return model;
            });

    assertThatThrownBy(lazy::get).hasMessage("tokenizer missing");
    assertThat(lazy.isLoaded()).isFalse();
    assertThat(lazy.get()).isSameAs(model);
  }

  @Test
  void concurrentFirstCallersShareOneInstance() throws Exception {
    ScoringModel model = mock(ScoringModel.class);
    AtomicInteger loads = new AtomicInteger();
    CountDownLatch go = new CountDownLatch(1);
    LazyScoringModel lazy =
        new LazyScoringModel(
            () -> {
              loads.incrementAndGet();
              return model;
            });

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<ScoringModel>> callers = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        callers.add(
            () -> {
              go.await();
              return lazy.get();
            });
      }
      List<Future<ScoringModel>> futures = new ArrayList<>();
      for (Callable<ScoringModel> caller : callers) {
        futures.add(pool.submit(caller));
      }
      go.countDown();
      for (Future<ScoringModel> future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(model);
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(loads).hasValue(1);
  }

  @Test
  void closeReleasesCloseableModel() throws Exception {
    ScoringModel model =
        mock(ScoringModel.class, withSettings().extraInterfaces(AutoCloseable.class));
    LazyScoringModel lazy = new LazyScoringModel(() -> model);
    lazy.get();

    lazy.close();

    verify((AutoCloseable) model).close();
    assertThat(lazy.isLoaded()).isFalse();
  }
}
