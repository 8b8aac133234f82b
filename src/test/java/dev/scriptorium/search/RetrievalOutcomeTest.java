package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetrievalOutcomeTest {

  @Test
  void successCarriesValue() {
    RetrievalOutcome<String> outcome = RetrievalOutcome.success("ok");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value()).isEqualTo("ok");
    assertThat(outcome.valueOr("fallback")).isEqualTo("ok");
    assertThat(outcome.reason()).isNull();
  }

  @Test
  void failureCarriesReasonAndDetail() {
    RetrievalOutcome<String> outcome =
        RetrievalOutcome.failure(FailureReason.TIMEOUT, "took too long");

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.reason()).isEqualTo(FailureReason.TIMEOUT);
    assertThat(outcome.detail()).isEqualTo("took too long");
    assertThat(outcome.valueOr("fallback")).isEqualTo("fallback");
    assertThat(outcome.valueOrGet(() -> "computed")).isEqualTo("computed");
    assertThatThrownBy(outcome::value).isInstanceOf(IllegalStateException.class);
  }
}
