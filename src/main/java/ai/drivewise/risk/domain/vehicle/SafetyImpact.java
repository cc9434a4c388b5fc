package ai.drivewise.risk.domain.vehicle;

import java.util.OptionalInt;

/**
 * Pricing and scoring effects of an overall crash-safety rating.
 *
 * <p>Ratings outside {@code 1..5}, and unset ratings, have no effect.</p>
 *
 * @param premiumAdjustment fractional premium change ({@code -0.15} for five stars to {@code +0.10} for one)
 * @param safetyScoreBoost safety score points added, {@code max(0, (rating - 3) * 10)}
 * @param riskReduction amount subtracted from the fused risk, {@code max(0, (rating - 3) * 0.05)}
 * @since 0.1.0
 */
public record SafetyImpact(double premiumAdjustment, int safetyScoreBoost, double riskReduction) {
  /** Impact of an unset or unrecognised rating. */
  public static final SafetyImpact NONE = new SafetyImpact(0d, 0, 0d);

  private static final double[] PREMIUM_BY_STARS = {0d, 0.10d, 0.05d, 0d, -0.08d, -0.15d};
  private static final double RISK_REDUCTION_PER_STAR = 0.05d;
  private static final int BOOST_PER_STAR = 10;

  /**
   * Looks up the impact for a rating.
   *
   * @param rating overall rating
   * @return impact, or {@link #NONE} when the rating is outside {@code 1..5}
   */
  public static SafetyImpact forRating(int rating) {
    if (rating < 1 || rating > 5) {
      return NONE;
    }
    int aboveNeutral = Math.max(0, rating - 3);
    return new SafetyImpact(
        PREMIUM_BY_STARS[rating],
        aboveNeutral * BOOST_PER_STAR,
        aboveNeutral * RISK_REDUCTION_PER_STAR);
  }

  /**
   * Looks up the impact for an optional rating.
   *
   * @param rating overall rating when present
   * @return impact, or {@link #NONE} when absent
   */
  public static SafetyImpact forRating(OptionalInt rating) {
    return rating == null || rating.isEmpty() ? NONE : forRating(rating.getAsInt());
  }
}
