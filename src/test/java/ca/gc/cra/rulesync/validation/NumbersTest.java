package ca.gc.cra.rulesync.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWithinRange() {
    assertEquals(8, Numbers.parseIntInRange("concurrency", " 8 ", 1, 64));
  }

  @Test
  void errorsNameTheSetting() {
    IllegalArgumentException range =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("concurrency", "65", 1, 64));
    assertEquals("concurrency must be between 1 and 64 (was 65)", range.getMessage());

    IllegalArgumentException format =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("maxRetries", "x", 0, 10));
    assertEquals("maxRetries must be an integer (was 'x')", format.getMessage());

    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("maxRetries", " ", 0, 10));
  }
}
