package ai.drivewise.risk.domain.vehicle;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * <strong>What:</strong> Crash-safety ratings and recall count for one vehicle.
 * <p><strong>Why:</strong> Feeds the vehicle adjustment of the fused risk score and the premium table.</p>
 * <p><strong>Role:</strong> Produced by vehicle safety sources; consumed by sinks, the signal cache and fusion.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep missing live ratings empty rather than inventing values.</li>
 *   <li>Pair every synthesized rating with the {@link VehicleSourceTag} that explains it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param recordId unique identifier referenced by risk scores
 * @param make manufacturer name
 * @param model model name
 * @param year model year, {@code 0} when unknown
 * @param vin optional VIN the record was requested for
 * @param overallRating overall star rating in {@code [1, 5]} when present
 * @param rolloverRating rollover star rating when present
 * @param frontalRating frontal crash star rating when present
 * @param sideRating side crash star rating when present
 * @param recallCount number of open recalls; {@code >= 0}
 * @param vehicleDescription upstream description, empty when unknown
 * @param ratingsVehicleId upstream ratings identifier when the lookup resolved one
 * @param collectedAt collection timestamp
 * @param sourceTag tier that produced the record
 * @since 0.1.0
 */
public record VehicleSafetyRecord(
    String recordId,
    String make,
    String model,
    int year,
    Optional<String> vin,
    OptionalInt overallRating,
    OptionalInt rolloverRating,
    OptionalInt frontalRating,
    OptionalInt sideRating,
    int recallCount,
    String vehicleDescription,
    OptionalLong ratingsVehicleId,
    Instant collectedAt,
    VehicleSourceTag sourceTag) {

  public VehicleSafetyRecord {
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(collectedAt, "collectedAt");
    Objects.requireNonNull(sourceTag, "sourceTag");
    make = make == null ? "" : make;
    model = model == null ? "" : model;
    vin = Objects.requireNonNullElse(vin, Optional.<String>empty());
    overallRating = requireStars("overallRating", overallRating);
    rolloverRating = requireStars("rolloverRating", rolloverRating);
    frontalRating = requireStars("frontalRating", frontalRating);
    sideRating = requireStars("sideRating", sideRating);
    vehicleDescription = vehicleDescription == null ? "" : vehicleDescription;
    ratingsVehicleId = Objects.requireNonNullElse(ratingsVehicleId, OptionalLong.empty());
    if (recallCount < 0) {
      throw new IllegalArgumentException("recallCount must be >= 0 (was " + recallCount + ")");
    }
    if (sourceTag != VehicleSourceTag.LIVE
        && (overallRating.isEmpty() || overallRating.getAsInt() != sourceTag.substituteRating())) {
      throw new IllegalArgumentException(sourceTag + " records must carry rating " + sourceTag.substituteRating());
    }
  }

  /**
   * Builds a synthesized record for the {@link VehicleSourceTag#DEFAULT} or
   * {@link VehicleSourceTag#ERROR_FALLBACK} tier; every rating is set to the tier's substitute.
   *
   * @param query vehicle the lookup was for
   * @param tag substitution tier; must not be {@link VehicleSourceTag#LIVE}
   * @param recallCount recall count already known for the vehicle
   * @param collectedAt substitution timestamp
   * @return tagged record
   */
  public static VehicleSafetyRecord substitute(
      VehicleQuery query, VehicleSourceTag tag, int recallCount, Instant collectedAt) {
    Objects.requireNonNull(query, "query");
    if (tag == VehicleSourceTag.LIVE) {
      throw new IllegalArgumentException("LIVE records are not synthesized");
    }
    OptionalInt rating = OptionalInt.of(tag.substituteRating());
    String description = tag == VehicleSourceTag.DEFAULT ? "Default rating" : "Rating unavailable";
    return new VehicleSafetyRecord(
        newId(),
        query.make(),
        query.model(),
        query.year(),
        query.vin(),
        rating,
        rating,
        rating,
        rating,
        recallCount,
        description,
        OptionalLong.empty(),
        collectedAt,
        tag);
  }

  /**
   * Returns a fresh record identifier.
   *
   * @return identifier prefixed with {@code vs-}
   */
  public static String newId() {
    return "vs-" + UUID.randomUUID();
  }

  /**
   * Cache key matching {@link VehicleQuery#key()}.
   *
   * @return upper-cased VIN when present, otherwise {@code YEAR|MAKE|MODEL}
   */
  public String key() {
    return vin.orElseGet(() -> VehicleQuery.keyFor(year, make, model));
  }

  /**
   * Pricing and score effects of the overall rating.
   *
   * @return impact derived from {@link #overallRating()}
   */
  public SafetyImpact impact() {
    return SafetyImpact.forRating(overallRating);
  }

  private static OptionalInt requireStars(String name, OptionalInt value) {
    OptionalInt effective = Objects.requireNonNullElse(value, OptionalInt.empty());
    if (effective.isPresent() && (effective.getAsInt() < 1 || effective.getAsInt() > 5)) {
      throw new IllegalArgumentException(name + " must be between 1 and 5 (was " + effective.getAsInt() + ")");
    }
    return effective;
  }
}
