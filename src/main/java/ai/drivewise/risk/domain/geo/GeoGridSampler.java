package ai.drivewise.risk.domain.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Expands a region centre into a square grid of sample coordinates.
 * <p><strong>Why:</strong> Traffic flow endpoints answer for a single point, so a region sweep needs a
 * deterministic set of points that cover the requested radius.</p>
 * <p><strong>Role:</strong> Pure domain function consumed by the traffic sweep.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit exactly {@code (2 * density + 1)^2} points, row-major from the south-west corner.</li>
 *   <li>Space rows by {@code radiusKm / density} kilometres using 111 km per degree of latitude.</li>
 *   <li>Widen column spacing by {@code 1 / cos(latitude)} so columns stay roughly equidistant on the ground.</li>
 *   <li>Keep every point distinct: rows that would cross a pole shift the whole band back inside [-90, 90], and
 *       steps are capped so neither the rows nor the wrapped columns can overlap.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Performance:</strong> O(density^2) allocations; no trigonometry inside the loop.</p>
 *
 * @implNote The cosine is floored at {@value #MIN_COS_LATITUDE} so grids centred at the poles stay finite.
 * @since 0.1.0
 */
public final class GeoGridSampler {
  /** Kilometres per degree of latitude. */
  public static final double KM_PER_DEGREE = 111.0d;
  static final double MIN_COS_LATITUDE = 0.01d;

  private GeoGridSampler() {}

  /**
   * Lays out the grid around {@code center}.
   *
   * @param center grid centre; must not be {@code null}
   * @param radiusKm half-width of the grid in kilometres; must be positive and finite
   * @param density number of steps on each side of the centre; {@code 0} yields only the centre
   * @return ordered, immutable list of grid coordinates
   * @throws IllegalArgumentException if {@code radiusKm} is not positive or {@code density} is negative
   */
  public static List<Coordinate> sample(Coordinate center, double radiusKm, int density) {
    Objects.requireNonNull(center, "center");
    if (!(radiusKm > 0d) || Double.isInfinite(radiusKm)) {
      throw new IllegalArgumentException("radiusKm must be positive (was " + radiusKm + ")");
    }
    if (density < 0) {
      throw new IllegalArgumentException("density must be >= 0 (was " + density + ")");
    }
    if (density == 0) {
      return List.of(center);
    }

    double latStep = Math.min(radiusKm / density / KM_PER_DEGREE, 180d / (2 * density));
    double cosLat = Math.max(Math.cos(Math.toRadians(center.latitude())), MIN_COS_LATITUDE);
    double lonStep = Math.min(latStep / cosLat, 360d / (2 * density + 1));
    double baseLat = shiftIntoRange(center.latitude(), density * latStep);

    int side = 2 * density + 1;
    List<Coordinate> points = new ArrayList<>(side * side);
    for (int i = -density; i <= density; i++) {
      double lat = clampLatitude(baseLat + i * latStep);
      for (int j = -density; j <= density; j++) {
        double lon = wrapLongitude(center.longitude() + j * lonStep);
        points.add(new Coordinate(lat, lon));
      }
    }
    return List.copyOf(points);
  }

  /**
   * Returns the number of points {@link #sample} produces for the given density.
   *
   * @param density grid density
   * @return {@code (2 * density + 1)^2}
   */
  public static int pointCount(int density) {
    int side = 2 * density + 1;
    return side * side;
  }

  /** Moves the band {@code [lat - halfSpan, lat + halfSpan]} so that it fits inside [-90, 90]. */
  private static double shiftIntoRange(double lat, double halfSpan) {
    if (lat + halfSpan > 90d) {
      return 90d - halfSpan;
    }
    if (lat - halfSpan < -90d) {
      return -90d + halfSpan;
    }
    return lat;
  }

  private static double clampLatitude(double lat) {
    return Math.max(-90d, Math.min(90d, lat));
  }

  private static double wrapLongitude(double lon) {
    if (lon >= -180d && lon <= 180d) {
      return lon;
    }
    double wrapped = ((lon + 180d) % 360d + 360d) % 360d - 180d;
    return wrapped;
  }
}
