package ai.drivewise.risk.infrastructure.source.tomtom;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.IncidentSource;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonSupport;
import ai.drivewise.risk.infrastructure.source.UrlParts;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IncidentSource} backed by the TomTom incident-details endpoint.
 *
 * <p>A failed request returns an empty list, like a response without incidents, but is logged and counted as
 * {@code source.incidents.error}. Incidents without usable geometry are placed at the query centre.</p>
 *
 * @since 0.1.0
 */
public final class TomTomIncidentSource implements IncidentSource {
  private static final Logger log = LoggerFactory.getLogger(TomTomIncidentSource.class);
  static final String CATEGORY_FILTER = "0,1,2,3,4,5,6,7,8,9,10,11";

  private final JsonHttpClient http;
  private final URI baseUrl;
  private final String apiKey;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public TomTomIncidentSource(
      JsonHttpClient http, URI baseUrl, String apiKey, ClockPort clock, MetricsPort metrics) {
    this.http = Objects.requireNonNull(http, "http");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public List<Incident> fetch(Coordinate center, double radiusKm) {
    Objects.requireNonNull(center, "center");
    try {
      Object body = http.getJson(incidentsUri(center, radiusKm));
      Instant now = clock.now();
      List<Incident> incidents = new ArrayList<>();
      for (Object node : JsonSupport.array(JsonSupport.field(body, "incidents").orElse(null))) {
        if (node instanceof Map<?, ?>) {
          incidents.add(toIncident(node, center, now));
        }
      }
      log.debug("TomTom reported {} incidents within {} km of {}", incidents.size(), radiusKm,
          center.toQueryValue());
      return incidents;
    } catch (IOException ex) {
      return failed(center, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failed(center, "interrupted");
    } catch (RuntimeException ex) {
      log.debug("Unreadable TomTom incident payload", ex);
      return failed(center, ex.toString());
    }
  }

  URI incidentsUri(Coordinate center, double radiusKm) {
    Map<String, String> params = UrlParts.params();
    params.put("key", apiKey);
    params.put("language", "en-US");
    params.put("categoryFilter", CATEGORY_FILTER);
    String path = String.format(Locale.ROOT, "/services/5/incidentDetails/s3/%s,%s/10/-1/json",
        center.toQueryValue(), formatRadius(radiusKm));
    return URI.create(baseUrl + path + UrlParts.query(params));
  }

  private static String formatRadius(double radiusKm) {
    return radiusKm == Math.rint(radiusKm)
        ? Long.toString((long) radiusKm)
        : String.format(Locale.ROOT, "%.3f", radiusKm);
  }

  private Incident toIncident(Object node, Coordinate center, Instant now) {
    String id = JsonSupport.field(node, "id").flatMap(JsonSupport::text)
        .orElseGet(() -> "inc-" + UUID.randomUUID());
    int category = (int) JsonSupport.number(JsonSupport.field(node, "iconCategory").orElse(null)).orElse(0);
    String description = JsonSupport.field(node, "description").flatMap(JsonSupport::text).orElse("");
    int severity = (int) Math.max(0d,
        JsonSupport.number(JsonSupport.field(node, "magnitude").orElse(null)).orElse(0));
    long delay = (long) Math.max(0d,
        JsonSupport.number(JsonSupport.field(node, "delay").orElse(null)).orElse(0));
    String road = JsonSupport.array(JsonSupport.field(node, "roadNumbers").orElse(null)).stream()
        .map(JsonSupport::text)
        .flatMap(Optional::stream)
        .findFirst()
        .orElse(Incident.UNKNOWN_ROAD);
    return new Incident(id, category, description, severity, location(node, center), delay, road, now);
  }

  private static Coordinate location(Object node, Coordinate center) {
    List<Object> coordinates = JsonSupport.array(JsonSupport.path(node, "geometry", "coordinates").orElse(null));
    if (coordinates.size() >= 2) {
      OptionalDouble lon = JsonSupport.number(coordinates.get(0));
      OptionalDouble lat = JsonSupport.number(coordinates.get(1));
      if (lat.isPresent() && lon.isPresent()
          && Math.abs(lat.getAsDouble()) <= 90d && Math.abs(lon.getAsDouble()) <= 180d) {
        return new Coordinate(lat.getAsDouble(), lon.getAsDouble());
      }
    }
    return center;
  }

  private List<Incident> failed(Coordinate center, String reason) {
    metrics.increment("source.incidents.error");
    log.warn("TomTom incident request near {} failed: {}", center.toQueryValue(), reason);
    return List.of();
  }
}
