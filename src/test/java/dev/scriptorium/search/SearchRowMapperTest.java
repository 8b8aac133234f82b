package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SearchRowMapperTest {

  private final SearchRowMapper mapper = new SearchRowMapper(new ObjectMapper());

  @Test
  void mapsNativeRow() {
    UUID chunkId = UUID.randomUUID();
    UUID documentId = UUID.randomUUID();

    SearchResult result =
        mapper.map(
            new Object[] {
              chunkId.toString(),
              documentId,
              "text",
              new BigDecimal("0.75"),
              "{\"heading_path\":\"Guide > Setup\",\"chunk_index\":2}",
              "Guide",
              "guide.md"
            });

    assertThat(result.chunkId()).isEqualTo(chunkId);
    assertThat(result.documentId()).isEqualTo(documentId);
    assertThat(result.similarity()).isEqualTo(0.75);
    assertThat(result.metadata())
        .containsEntry("heading_path", "Guide > Setup")
        .containsEntry("chunk_index", 2);
    assertThat(result.documentSource()).isEqualTo("guide.md");
  }

  @Test
  void unreadableMetadataBecomesEmpty() {
    SearchResult result =
        mapper.map(
            new Object[] {UUID.randomUUID(), UUID.randomUUID(), "t", 0.1, "{broken", null, null});

    assertThat(result.metadata()).isEmpty();
    assertThat(result.documentTitle()).isEmpty();
  }
}
