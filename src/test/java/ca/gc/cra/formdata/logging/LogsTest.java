package ca.gc.cra.formdata.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void shortValuesPassThrough() {
    String value = "address[city]";
    assertSame(value, Logs.truncate(value, 64));
  }

  @Test
  void longValuesAreCutWithSummary() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncationDropsSplitMultiByteCharacter() {
    assertEquals("é... (truncated, 3 of 6)", Logs.truncate("ééé", 3));
  }

  @Test
  void nullBecomesPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void partNameUsesNameBudget() {
    String name = "n".repeat(Logs.NAME_BUDGET + 10);
    String truncated = Logs.partName(name);

    assertTrue(truncated.startsWith("n".repeat(Logs.NAME_BUDGET) + "... (truncated"));
  }
}
