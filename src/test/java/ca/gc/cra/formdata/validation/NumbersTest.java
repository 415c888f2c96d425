package ca.gc.cra.formdata.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(64L, Numbers.requireRange("maxDepth", 64, 1, 4096));
    assertEquals(1L, Numbers.requireRange("maxDepth", 1, 1, 4096));
  }

  @Test
  void requireRangeRejectsOutOfBounds() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("maxDepth", 0, 1, 4096));
    assertTrue(ex.getMessage().startsWith("maxDepth must be between 1 and 4096"));
  }
}
