package ai.drivewise.risk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("batchSize", 1L, 1L, 500L));
    assertEquals(500L, Numbers.requireRange("batchSize", 500L, 1L, 500L));
  }

  @Test
  void requireRangeRejectsOutOfRangeWithName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("parallelism", 0L, 1L, 64L));
    assertTrue(ex.getMessage().startsWith("parallelism"));
  }

  @Test
  void requireRangeRejectsNonFiniteDoubles() {
    assertEquals(0.5d, Numbers.requireRange("radiusKm", 0.5d, 0.1d, 100d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("radiusKm", Double.NaN, 0d, 1d));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("radiusKm", Double.POSITIVE_INFINITY, 0d, Double.MAX_VALUE));
  }

  @Test
  void blankNameFallsBackToValueLabel() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange(" ", 5L, 0L, 1L));
    assertTrue(ex.getMessage().startsWith("value"));
  }
}
