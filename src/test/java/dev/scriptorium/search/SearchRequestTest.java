package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void queryOnlyLeavesOptionsToConfiguration() {
    SearchRequest request = new SearchRequest("how do cats sleep");

    assertThat(request.limit()).isNull();
    assertThat(request.hybrid()).isNull();
    assertThat(request.rerank()).isNull();
  }

  @Test
  void rejectsBlankQuery() {
    assertThatThrownBy(() -> new SearchRequest("  "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("blank");
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThatThrownBy(() -> new SearchRequest("cats", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
