package ai.drivewise.risk.validation;

/**
 * Range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Ensures {@code min <= value <= max}.
   *
   * @param name option name used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(label(name) + " must be between " + min + " and " + max
          + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code min <= value <= max} and that {@code value} is finite.
   *
   * @param name option name used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range or not finite
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(label(name) + " must be between " + min + " and " + max
          + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
