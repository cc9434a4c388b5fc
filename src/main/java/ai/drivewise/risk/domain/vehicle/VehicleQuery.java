package ai.drivewise.risk.domain.vehicle;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One vehicle to rate: either a model-year/make/model triple, a VIN, or both.
 *
 * <p>When only a VIN is known the triple is left unresolved ({@code year == 0}, blank make and model) and the
 * safety source decodes the VIN first.</p>
 *
 * @param year model year, or {@code 0} when unresolved
 * @param make manufacturer name; may be blank when unresolved
 * @param model model name; may be blank when unresolved
 * @param vin optional vehicle identification number
 * @since 0.1.0
 */
public record VehicleQuery(int year, String make, String model, Optional<String> vin) {

  public VehicleQuery {
    make = make == null ? "" : make.trim();
    model = model == null ? "" : model.trim();
    vin = Objects.requireNonNullElse(vin, Optional.<String>empty())
        .map(v -> v.trim().toUpperCase(Locale.ROOT))
        .filter(v -> !v.isEmpty());
    if (year < 0) {
      throw new IllegalArgumentException("year must be >= 0 (was " + year + ")");
    }
    boolean triple = year > 0 && !make.isEmpty() && !model.isEmpty();
    if (!triple && vin.isEmpty()) {
      throw new IllegalArgumentException("vehicle requires year, make and model or a VIN");
    }
  }

  /**
   * Creates a query for a known model-year triple.
   *
   * @param year model year
   * @param make manufacturer
   * @param model model name
   * @return query without VIN
   */
  public static VehicleQuery of(int year, String make, String model) {
    return new VehicleQuery(year, make, model, Optional.empty());
  }

  /**
   * Creates a query identified only by VIN.
   *
   * @param vin vehicle identification number
   * @return unresolved query
   */
  public static VehicleQuery ofVin(String vin) {
    return new VehicleQuery(0, "", "", Optional.of(Objects.requireNonNull(vin, "vin")));
  }

  /**
   * Parses {@code year:make:model[:vin]} or {@code vin:VIN}.
   *
   * @param spec worklist entry
   * @return parsed query
   * @throws IllegalArgumentException if the entry is malformed
   */
  public static VehicleQuery parse(String spec) {
    Objects.requireNonNull(spec, "spec");
    String[] parts = spec.trim().split(":");
    if (parts.length == 2 && parts[0].trim().equalsIgnoreCase("vin")) {
      return ofVin(parts[1]);
    }
    if (parts.length != 3 && parts.length != 4) {
      throw new IllegalArgumentException("vehicle must use year:make:model[:vin] or vin:VIN (was '" + spec + "')");
    }
    int year;
    try {
      year = Integer.parseInt(parts[0].trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("vehicle year must be numeric (was '" + parts[0] + "')", ex);
    }
    Optional<String> vin = parts.length == 4 ? Optional.of(parts[3]) : Optional.empty();
    return new VehicleQuery(year, parts[1], parts[2], vin);
  }

  /**
   * Indicates whether the make/model triple still has to be decoded from the VIN.
   *
   * @return {@code true} when only the VIN is known
   */
  public boolean needsDecode() {
    return year == 0 || make.isEmpty() || model.isEmpty();
  }

  /**
   * Cache key shared by the vehicle sweep and on-demand scoring.
   *
   * @return upper-cased VIN when present, otherwise {@code YEAR|MAKE|MODEL}
   */
  public String key() {
    return vin.orElseGet(() -> keyFor(year, make, model));
  }

  static String keyFor(int year, String make, String model) {
    return (year + "|" + make + "|" + model).toUpperCase(Locale.ROOT);
  }
}
