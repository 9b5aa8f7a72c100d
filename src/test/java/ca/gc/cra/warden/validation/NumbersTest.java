package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void longRangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("interval", 1L, 1L, 10L));
    assertEquals(10L, Numbers.requireRange("interval", 10L, 1L, 10L));
  }

  @Test
  void longRangeRejectsOutOfBounds() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("interval", 0L, 1L, 10L));
    assertEquals("interval must be between 1 and 10 (was 0)", ex.getMessage());
  }

  @Test
  void doubleRangeRejectsNaN() {
    assertEquals(0.5, Numbers.requireRange("threshold", 0.5, 0.0, 1.0), 1e-9);
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("threshold", Double.NaN, 0.0, 1.0));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange(" ", 1.5, 0.0, 1.0));
    assertTrue(ex.getMessage().startsWith("value must be between"));
  }
}
