package ai.drivewise.risk.domain.geo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GeoGridSamplerTest {
  private static final Coordinate SAN_FRANCISCO = new Coordinate(37.7749, -122.4194);

  @Test
  void densityFiveProducesElevenByElevenGrid() {
    List<Coordinate> points = GeoGridSampler.sample(SAN_FRANCISCO, 25d, 5);

    assertEquals(121, points.size());
    assertEquals(121, GeoGridSampler.pointCount(5));
  }

  @Test
  void centrePointSitsInTheMiddleOfTheGrid() {
    List<Coordinate> points = GeoGridSampler.sample(SAN_FRANCISCO, 25d, 5);

    Coordinate middle = points.get(60);
    assertEquals(SAN_FRANCISCO.latitude(), middle.latitude(), 1e-9);
    assertEquals(SAN_FRANCISCO.longitude(), middle.longitude(), 1e-9);
  }

  @Test
  void gridStartsAtSouthWestCornerAndSpansTheRadius() {
    List<Coordinate> points = GeoGridSampler.sample(SAN_FRANCISCO, 25d, 5);

    Coordinate first = points.get(0);
    Coordinate last = points.get(points.size() - 1);
    double latSpan = 25d / GeoGridSampler.KM_PER_DEGREE;
    assertEquals(SAN_FRANCISCO.latitude() - latSpan, first.latitude(), 1e-9);
    assertEquals(SAN_FRANCISCO.latitude() + latSpan, last.latitude(), 1e-9);
    assertTrue(first.longitude() < SAN_FRANCISCO.longitude());
    assertTrue(last.longitude() > SAN_FRANCISCO.longitude());
  }

  @Test
  void rowsShareLatitudeAndColumnsShareLongitude() {
    List<Coordinate> points = GeoGridSampler.sample(SAN_FRANCISCO, 10d, 2);

    assertEquals(points.get(0).latitude(), points.get(4).latitude(), 0d);
    assertEquals(points.get(0).longitude(), points.get(5).longitude(), 0d);
    assertTrue(points.get(5).latitude() > points.get(0).latitude());
  }

  @Test
  void longitudeStepWidensAwayFromTheEquator() {
    Coordinate equator = new Coordinate(0d, 10d);
    Coordinate north = new Coordinate(60d, 10d);

    double equatorStep = GeoGridSampler.sample(equator, 10d, 1).get(1).longitude()
        - GeoGridSampler.sample(equator, 10d, 1).get(0).longitude();
    double northStep = GeoGridSampler.sample(north, 10d, 1).get(1).longitude()
        - GeoGridSampler.sample(north, 10d, 1).get(0).longitude();

    assertEquals(2d * equatorStep, northStep, 1e-6);
  }

  @Test
  void densityZeroReturnsOnlyTheCentre() {
    assertEquals(List.of(SAN_FRANCISCO), GeoGridSampler.sample(SAN_FRANCISCO, 25d, 0));
    assertEquals(1, GeoGridSampler.pointCount(0));
  }

  @Test
  void nearPoleStaysWithinValidCoordinates() {
    Coordinate pole = new Coordinate(89.99, 179.9);

    List<Coordinate> points = GeoGridSampler.sample(pole, 50d, 3);

    assertEquals(49, points.size());
    assertEquals(49, Set.copyOf(points).size());
    for (Coordinate point : points) {
      assertTrue(point.latitude() <= 90d && point.latitude() >= -90d);
      assertTrue(point.longitude() <= 180d && point.longitude() >= -180d);
    }
  }

  @Test
  void densityOneAroundSanFranciscoGivesNineDistinctPointsIncludingTheCentre() {
    List<Coordinate> points = GeoGridSampler.sample(SAN_FRANCISCO, 10d, 1);

    assertEquals(9, points.size());
    assertEquals(9, Set.copyOf(points).size());
    assertTrue(points.contains(SAN_FRANCISCO));
  }

  @Test
  void gridCentredOnThePoleKeepsEveryPointDistinct() {
    List<Coordinate> points = GeoGridSampler.sample(new Coordinate(90d, 0d), 50d, 2);

    assertEquals(25, points.size());
    assertEquals(25, Set.copyOf(points).size());
    for (Coordinate point : points) {
      assertTrue(point.latitude() <= 90d && point.latitude() >= -90d);
    }
  }

  @Test
  void southPoleAndHugeRadiusStillYieldDistinctPoints() {
    List<Coordinate> south = GeoGridSampler.sample(new Coordinate(-89.5d, 45d), 200d, 4);
    List<Coordinate> huge = GeoGridSampler.sample(new Coordinate(10d, 170d), 30_000d, 3);

    assertEquals(81, Set.copyOf(south).size());
    assertEquals(49, Set.copyOf(huge).size());
    for (Coordinate point : huge) {
      assertTrue(point.latitude() <= 90d && point.latitude() >= -90d);
      assertTrue(point.longitude() <= 180d && point.longitude() >= -180d);
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> GeoGridSampler.sample(SAN_FRANCISCO, 0d, 3));
    assertThrows(IllegalArgumentException.class, () -> GeoGridSampler.sample(SAN_FRANCISCO, -1d, 3));
    assertThrows(IllegalArgumentException.class, () -> GeoGridSampler.sample(SAN_FRANCISCO, Double.NaN, 3));
    assertThrows(IllegalArgumentException.class, () -> GeoGridSampler.sample(SAN_FRANCISCO, 5d, -1));
    assertThrows(NullPointerException.class, () -> GeoGridSampler.sample(null, 5d, 1));
  }
}
