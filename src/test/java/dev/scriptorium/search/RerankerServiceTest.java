package dev.scriptorium.search;

import static dev.scriptorium.fixture.SearchResultBuilder.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RerankerServiceTest {

  private static final Map<String, Double> SCORES =
      Map.of("cats", 0.1, "dogs", 0.9, "birds", 0.5);

  @Mock ScoringModel scoringModel;

  @Captor ArgumentCaptor<List<TextSegment>> segmentsCaptor;

  private RerankerProperties properties;
  private ExecutorService executor;
  private AtomicInteger loads;
  private RerankerService service;

  @BeforeEach
  void setUp() {
    properties = new RerankerProperties();
    properties.setEnabled(true);
    properties.setBatchSize(2);
    properties.setTimeout(Duration.ofSeconds(5));
    executor = Executors.newSingleThreadExecutor();
    loads = new AtomicInteger();
    LazyScoringModel lazyModel =
        new LazyScoringModel(
            () -> {
              loads.incrementAndGet();
              return scoringModel;
            });
    service = new RerankerService(lazyModel, properties, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private void givenScoresByContent() {
    given(scoringModel.scoreAll(anyList(), eq("pets")))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream().map(segment -> SCORES.get(segment.text())).toList());
            });
  }

  private static List<SearchResult> candidates() {
    return List.of(result("cats", 0.9), result("dogs", 0.8), result("birds", 0.7));
  }

  @Test
  void reordersByModelScoreAndReplacesSimilarity() {
    givenScoresByContent();

    RetrievalOutcome<List<SearchResult>> outcome = service.score("pets", candidates(), null);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value())
        .extracting(SearchResult::content)
        .containsExactly("dogs", "birds", "cats");
    assertThat(outcome.value())
        .extracting(SearchResult::similarity)
        .containsExactly(0.9, 0.5, 0.1);
  }

  @Test
  void keepsOnlyTopK() {
    givenScoresByContent();

    List<SearchResult> reranked = service.rerank("pets", candidates(), 1);

    assertThat(reranked).extracting(SearchResult::content).containsExactly("dogs");
  }

  @Test
  void scoresInBatches() {
    givenScoresByContent();

    service.score("pets", candidates(), null);

    verify(scoringModel, times(2)).scoreAll(segmentsCaptor.capture(), eq("pets"));
    assertThat(segmentsCaptor.getAllValues()).extracting(List::size).containsExactly(2, 1);
  }

  @Test
  void emptyCandidatesNeverLoadTheModel() {
    RetrievalOutcome<List<SearchResult>> outcome = service.score("pets", List.of(), 5);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value()).isEmpty();
    assertThat(loads).hasValue(0);
    verifyNoInteractions(scoringModel);
  }

  @Test
  void disabledRerankerReturnsInputUnchanged() {
    properties.setEnabled(false);
    List<SearchResult> input = candidates();

    assertThat(service.score("pets", input, null).reason()).isEqualTo(FailureReason.DISABLED);
    assertThat(service.rerank("pets", input, null)).isSameAs(input);
    assertThat(loads).hasValue(0);
  }

  @Test
  void modelLoadFailureReturnsInputUnchanged() {
    RerankerService failing =
        new RerankerService(
            new LazyScoringModel(
                () -> {
                  throw new IllegalStateException("model.onnx not found");
                }),
            properties,
            executor);
    List<SearchResult> input = candidates();

    RetrievalOutcome<List<SearchResult>> outcome = failing.score("pets", input, null);

    assertThat(outcome.reason()).isEqualTo(FailureReason.MODEL_LOAD);
    assertThat(outcome.detail()).contains("model.onnx not found");
    assertThat(failing.rerank("pets", input, null)).isSameAs(input);
  }

  @Test
  void inferenceFailureReturnsInputUnchanged() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willThrow(new RuntimeException("ONNX session error"));
    List<SearchResult> input = candidates();

    RetrievalOutcome<List<SearchResult>> outcome = service.score("pets", input, null);

    assertThat(outcome.reason()).isEqualTo(FailureReason.INFERENCE);
    assertThat(service.rerank("pets", input, 2)).isSameAs(input);
  }

  @Test
  void scoreCountMismatchIsAnInferenceFailure() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willReturn(Response.from(List.of(0.5)));

    RetrievalOutcome<List<SearchResult>> outcome = service.score("pets", candidates(), null);

    assertThat(outcome.reason()).isEqualTo(FailureReason.INFERENCE);
    assertThat(outcome.detail()).contains("returned 1 scores for 2 pairs");
  }

  @Test
  void slowInferenceTimesOutAndReleasesTheWorker() throws Exception {
    properties.setTimeout(Duration.ofMillis(50));
    CountDownLatch interrupted = new CountDownLatch(1);
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willAnswer(
            invocation -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
              return Response.from(List.of());
            });

    RetrievalOutcome<List<SearchResult>> outcome = service.score("pets", candidates(), null);

    assertThat(outcome.reason()).isEqualTo(FailureReason.TIMEOUT);
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    Future<String> next = executor.submit(() -> "free");
    assertThat(next.get(2, TimeUnit.SECONDS)).isEqualTo("free");
  }

  @Test
  void modelIsLoadedOnceAcrossCalls() {
    givenScoresByContent();

    service.score("pets", candidates(), null);
    service.score("pets", candidates(), null);

    assertThat(loads).hasValue(1);
  }

  @Test
  void rejectsNonPositiveTopK() {
    assertThatThrownBy(() -> service.score("pets", candidates(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
