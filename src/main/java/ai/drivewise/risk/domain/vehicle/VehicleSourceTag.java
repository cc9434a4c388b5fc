package ai.drivewise.risk.domain.vehicle;

/**
 * Tier that produced a {@link VehicleSafetyRecord}.
 *
 * @since 0.1.0
 */
public enum VehicleSourceTag {
  /** Ratings parsed from a successful lookup. */
  LIVE(4),
  /** Lookup succeeded but returned no usable rating; a neutral-good rating of 4 is substituted. */
  DEFAULT(4),
  /** Lookup failed; a neutral rating of 3 is substituted. */
  ERROR_FALLBACK(3);

  private final int substituteRating;

  VehicleSourceTag(int substituteRating) {
    this.substituteRating = substituteRating;
  }

  /**
   * Rating written into synthesized records of this tier.
   *
   * @return substitute rating in {@code [1, 5]}
   */
  public int substituteRating() {
    return substituteRating;
  }
}
