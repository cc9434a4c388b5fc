package ai.drivewise.risk.domain.geo;

/**
 * <strong>What:</strong> WGS84 point expressed in decimal degrees.
 * <p><strong>Why:</strong> Every traffic sample, incident and grid cell is keyed by a location; validating it once
 * at construction keeps upstream URLs and nearest-sample lookups free of out-of-range values.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param latitude latitude in {@code [-90, 90]}
 * @param longitude longitude in {@code [-180, 180]}
 * @since 0.1.0
 */
public record Coordinate(double latitude, double longitude) {
  private static final double EARTH_RADIUS_KM = 6371.0d;

  /**
   * Validates the coordinate bounds.
   *
   * @throws IllegalArgumentException if either component is NaN or outside its range
   */
  public Coordinate {
    if (Double.isNaN(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude must be between -90 and 90 (was " + latitude + ")");
    }
    if (Double.isNaN(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude must be between -180 and 180 (was " + longitude + ")");
    }
  }

  /**
   * Great-circle distance to another coordinate using the haversine formula.
   *
   * @param other target coordinate; must not be {@code null}
   * @return distance in kilometres
   */
  public double distanceKm(Coordinate other) {
    double lat1 = Math.toRadians(latitude);
    double lat2 = Math.toRadians(other.latitude);
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(other.longitude - longitude);
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1d, Math.sqrt(a)));
  }

  /**
   * Formats the coordinate as {@code lat,lon}, the form accepted by the TomTom point parameter.
   *
   * @return comma separated latitude and longitude
   */
  public String toQueryValue() {
    return latitude + "," + longitude;
  }
}
