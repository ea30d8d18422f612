package dev.harvest.domain.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AttributesTest {

  @Test
  void widensNumbersSoIntAndLongCompareEqual() {
    Map<String, Object> fromCode = Attributes.normalize(Map.of("count", 3, "ratio", 0.5f));
    Map<String, Object> fromDisk = Attributes.normalize(Map.of("count", 3L, "ratio", 0.5d));

    assertEquals(fromDisk, fromCode);
    assertEquals(3L, fromCode.get("count"));
  }

  @Test
  void sortsKeysAndCopiesNestedStructures() {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("zeta", List.of(1, "two"));
    source.put("alpha", Map.of("b", 2, "a", 1));

    Map<String, Object> normalized = Attributes.normalize(source);

    assertEquals(List.of("alpha", "zeta"), List.copyOf(normalized.keySet()));
    assertEquals(List.of(1L, "two"), normalized.get("zeta"));
    assertThrows(UnsupportedOperationException.class, () -> normalized.put("x", "y"));
  }

  @Test
  void rejectsUnsupportedValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Attributes.normalize(Map.of("when", Instant.EPOCH)));
    assertTrue(ex.getMessage().contains("when"));
  }

  @Test
  void contentRecordTracksLastSeenBuild() {
    ContentRecord record = new ContentRecord(
        RecordVariant.POSTING, "https://example.org/a", Map.of("title", "A"), "normalize", Instant.EPOCH, "b1");

    ContentRecord affirmed = record.affirm("normalize", Instant.EPOCH.plusSeconds(60), "b2");

    assertTrue(affirmed.seenIn("b2"));
    assertEquals(record.attributes(), affirmed.attributes());
    assertEquals("A", affirmed.text("title"));
  }
}
