package ai.drivewise.risk.config;

import java.util.Locale;

/**
 * Destination for collected signals and computed scores.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Newline-delimited JSON files, one per record type. */
  NDJSON,
  /** Versioned Kafka topics; requires {@code kafkaBootstrap}. */
  KAFKA,
  /** Records are dropped after a debug log line. */
  NONE;

  /**
   * Parses a case-insensitive sink name.
   *
   * @param value raw value; blank selects {@code fallback}
   * @param fallback value used when {@code value} is blank
   * @return parsed sink type
   * @throws IllegalArgumentException if {@code value} names no sink
   */
  public static SinkType fromString(String value, SinkType fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return SinkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sink must be ndjson, kafka or none (was '" + value + "')", ex);
    }
  }
}
