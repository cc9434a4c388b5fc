package ai.drivewise.risk.infrastructure.source.tomtom;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.RouteTrafficSource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.RouteTraffic;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonSupport;
import ai.drivewise.risk.infrastructure.source.UrlParts;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RouteTrafficSource} backed by the TomTom routing {@code calculateRoute} endpoint with live traffic.
 *
 * <p>Only the first route of the response is used. Its {@code summary} gives length, travel time and traffic
 * delay; the first leg gives the geometry. Failures and responses without a route are counted as
 * {@code source.route.error} and {@code source.route.empty}.</p>
 *
 * @since 0.1.0
 */
public final class TomTomRouteTrafficSource implements RouteTrafficSource {
  private static final Logger log = LoggerFactory.getLogger(TomTomRouteTrafficSource.class);

  private final JsonHttpClient http;
  private final URI baseUrl;
  private final String apiKey;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the source.
   *
   * @param http JSON client
   * @param baseUrl routing API base, e.g. {@code https://api.tomtom.com/routing}
   * @param apiKey TomTom API key
   * @param clock clock for timestamps
   * @param metrics metrics sink
   */
  public TomTomRouteTrafficSource(
      JsonHttpClient http, URI baseUrl, String apiKey, ClockPort clock, MetricsPort metrics) {
    this.http = Objects.requireNonNull(http, "http");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public Optional<RouteTraffic> route(Coordinate origin, Coordinate destination) {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(destination, "destination");
    try {
      Object body = http.getJson(routeUri(origin, destination));
      List<Object> routes = JsonSupport.array(JsonSupport.field(body, "routes").orElse(null));
      if (routes.isEmpty()) {
        metrics.increment("source.route.empty");
        log.info("TomTom found no route from {} to {}", origin.toQueryValue(), destination.toQueryValue());
        return Optional.empty();
      }
      Object route = routes.get(0);
      Object summary = JsonSupport.field(route, "summary").orElse(null);
      long length = whole(summary, "lengthInMeters");
      long travel = whole(summary, "travelTimeInSeconds");
      long delay = whole(summary, "trafficDelayInSeconds");
      metrics.increment("source.route.live");
      return Optional.of(new RouteTraffic(
          origin,
          destination,
          length,
          travel,
          delay,
          RouteTraffic.congestionFor(length, travel, delay),
          points(route),
          clock.now()));
    } catch (IOException ex) {
      return failed(origin, destination, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failed(origin, destination, "interrupted");
    } catch (RuntimeException ex) {
      log.debug("Unreadable TomTom route payload", ex);
      return failed(origin, destination, ex.toString());
    }
  }

  URI routeUri(Coordinate origin, Coordinate destination) {
    Map<String, String> params = UrlParts.params();
    params.put("key", apiKey);
    params.put("traffic", "true");
    params.put("travelMode", "car");
    return URI.create(baseUrl + "/1/calculateRoute/" + origin.toQueryValue() + ":" + destination.toQueryValue()
        + "/json" + UrlParts.query(params));
  }

  private static long whole(Object node, String field) {
    return (long) Math.max(0d, JsonSupport.number(JsonSupport.field(node, field).orElse(null)).orElse(0));
  }

  private static List<Coordinate> points(Object route) {
    List<Object> legs = JsonSupport.array(JsonSupport.field(route, "legs").orElse(null));
    if (legs.isEmpty()) {
      return List.of();
    }
    List<Coordinate> points = new ArrayList<>();
    for (Object point : JsonSupport.array(JsonSupport.field(legs.get(0), "points").orElse(null))) {
      OptionalDouble lat = JsonSupport.number(JsonSupport.field(point, "latitude").orElse(null));
      OptionalDouble lon = JsonSupport.number(JsonSupport.field(point, "longitude").orElse(null));
      if (lat.isPresent() && lon.isPresent()) {
        points.add(new Coordinate(lat.getAsDouble(), lon.getAsDouble()));
      }
    }
    return points;
  }

  private Optional<RouteTraffic> failed(Coordinate origin, Coordinate destination, String reason) {
    metrics.increment("source.route.error");
    log.warn("TomTom route request {} -> {} failed: {}", origin.toQueryValue(), destination.toQueryValue(), reason);
    return Optional.empty();
  }
}
