package ai.drivewise.risk.domain.geo;

import java.util.List;
import java.util.Objects;

/**
 * Named sweep area identified by its centre coordinate.
 *
 * @param name display name used in logs and sink records
 * @param center region centre
 * @since 0.1.0
 */
public record Region(String name, Coordinate center) {
  /**
   * Cities swept when no regions are configured.
   */
  public static final List<Region> DEFAULT_CITIES = List.of(
      new Region("San Francisco", new Coordinate(37.7749, -122.4194)),
      new Region("Los Angeles", new Coordinate(34.0522, -118.2437)),
      new Region("New York", new Coordinate(40.7128, -74.0060)),
      new Region("Chicago", new Coordinate(41.8781, -87.6298)),
      new Region("Houston", new Coordinate(29.7604, -95.3698)),
      new Region("Phoenix", new Coordinate(33.4484, -112.0740)),
      new Region("Philadelphia", new Coordinate(39.9526, -75.1652)),
      new Region("Dallas", new Coordinate(32.7767, -96.7970)),
      new Region("Palo Alto", new Coordinate(37.4419, -122.1430)),
      new Region("Seattle", new Coordinate(47.6062, -122.3321)));

  public Region {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(center, "center");
    if (name.isBlank()) {
      throw new IllegalArgumentException("region name must not be blank");
    }
  }

  /**
   * Parses {@code name:lat,lon}.
   *
   * @param spec region specification
   * @return parsed region
   * @throws IllegalArgumentException if the specification is malformed
   */
  public static Region parse(String spec) {
    Objects.requireNonNull(spec, "spec");
    int colon = spec.lastIndexOf(':');
    if (colon <= 0 || colon == spec.length() - 1) {
      throw new IllegalArgumentException("region must use name:lat,lon (was '" + spec + "')");
    }
    String name = spec.substring(0, colon).trim();
    String[] parts = spec.substring(colon + 1).split(",");
    if (parts.length != 2) {
      throw new IllegalArgumentException("region must use name:lat,lon (was '" + spec + "')");
    }
    try {
      return new Region(name, new Coordinate(
          Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim())));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("region coordinates must be numeric (was '" + spec + "')", ex);
    }
  }
}
