package dev.scriptorium.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetadataKeysTest {

  @Test
  void nullAndEmptyBecomeEmptyMap() {
    assertThat(MetadataKeys.validate(null)).isEmpty();
    assertThat(MetadataKeys.validate(Map.of())).isEmpty();
  }

  @Test
  void acceptsUnknownKeysWithJsonValues() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("tags", List.of("a", 1, true));
    metadata.put("nested", Map.of("depth", 2.5));
    metadata.put("missing", null);

    assertThat(MetadataKeys.validate(metadata))
        .containsEntry("tags", List.of("a", 1, true))
        .containsKey("missing");
  }

  @Test
  void rejectsWrongTypeForKnownKey() {
    assertThatThrownBy(() -> MetadataKeys.validate(Map.of(MetadataKeys.UPLOADED, "yes")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expects Boolean but got String");
  }

  @Test
  void rejectsValuesThatAreNotJson() {
    assertThatThrownBy(() -> MetadataKeys.validate(Map.of("when", new Object())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unsupported value type");
  }

  @Test
  void rejectsBlankKeys() {
    assertThatThrownBy(() -> MetadataKeys.validate(Map.of(" ", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void returnsUnmodifiableCopy() {
    Map<String, Object> validated = MetadataKeys.validate(Map.of("k", "v"));

    assertThatThrownBy(() -> validated.put("other", "x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
