package ai.drivewise.risk.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String checks for configuration values and Kafka topic names.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {}

  /**
   * Trims {@code value} and rejects blank or control-character input.
   *
   * @param name option name used in error messages
   * @param value value to check
   * @return trimmed value
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name or prefix.
   *
   * @param name option name used in error messages
   * @param topic topic to check
   * @return trimmed topic
   */
  public static String sanitizeTopic(String name, String topic) {
    String trimmed = requireNonBlank(name, topic);
    if (trimmed.length() > MAX_TOPIC_LENGTH || !TOPIC_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label(name)
          + " must be at most " + MAX_TOPIC_LENGTH + " letters, digits, dots, underscores or hyphens");
    }
    return trimmed;
  }

  /**
   * Validates a credential such as an API key: printable ASCII without spaces.
   *
   * @param name option name used in error messages
   * @param value value to check
   * @param maxLength maximum length
   * @return trimmed value
   */
  public static String requireToken(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c <= 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII without spaces");
      }
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
