package dev.harvest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInsideBounds() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 64));
    assertEquals(64, Numbers.requireRange("workers", 64, 1, 64));
  }

  @Test
  void requireRangeReportsBoundsAndValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("workers", 65, 1, 64));

    assertEquals("workers must be between 1 and 64 (was 65)", ex.getMessage());
  }

  @Test
  void parseRangeTrimsInput() {
    assertEquals(30, Numbers.parseRange("timeout", " 30 ", 0, 3_600));
  }

  @Test
  void parseRangeRejectsNonIntegers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("timeout", "3.5", 0, 3_600));
    assertTrue(ex.getMessage().contains("must be an integer"));

    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("timeout", null, 0, 10));
  }
}
