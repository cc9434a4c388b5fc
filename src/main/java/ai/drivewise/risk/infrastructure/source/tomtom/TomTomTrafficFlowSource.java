package ai.drivewise.risk.infrastructure.source.tomtom;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.TrafficFlowSource;
import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonSupport;
import ai.drivewise.risk.infrastructure.source.UrlParts;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TrafficFlowSource} backed by the TomTom flow-segment endpoint.
 * <p><strong>Failure handling:</strong> Non-2xx responses, timeouts, malformed bodies and responses without
 * {@code flowSegmentData} all yield {@link TrafficSample#fallback}. Interrupts are restored.</p>
 * <p><strong>Observability:</strong> {@code source.traffic.live} and {@code source.traffic.fallback}.</p>
 *
 * @since 0.1.0
 */
public final class TomTomTrafficFlowSource implements TrafficFlowSource {
  private static final Logger log = LoggerFactory.getLogger(TomTomTrafficFlowSource.class);
  static final String FLOW_PATH = "/services/4/flowSegmentData/absolute/10/json";

  private final JsonHttpClient http;
  private final URI baseUrl;
  private final String apiKey;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the source.
   *
   * @param http JSON client
   * @param baseUrl traffic API base, e.g. {@code https://api.tomtom.com/traffic}
   * @param apiKey TomTom API key
   * @param clock clock for sample timestamps
   * @param metrics metrics sink
   */
  public TomTomTrafficFlowSource(
      JsonHttpClient http, URI baseUrl, String apiKey, ClockPort clock, MetricsPort metrics) {
    this.http = Objects.requireNonNull(http, "http");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public TrafficSample fetch(Coordinate coordinate) {
    Objects.requireNonNull(coordinate, "coordinate");
    try {
      Object body = http.getJson(flowUri(coordinate));
      Object segment = JsonSupport.field(body, "flowSegmentData").orElse(null);
      if (!(segment instanceof Map<?, ?>)) {
        log.warn("TomTom flow response for {} has no flowSegmentData; using fallback", coordinate.toQueryValue());
        return fallback(coordinate);
      }
      OptionalDouble current = JsonSupport.number(JsonSupport.field(segment, "currentSpeed").orElse(null));
      OptionalDouble freeFlow = JsonSupport.number(JsonSupport.field(segment, "freeFlowSpeed").orElse(null));
      if (current.isEmpty() || freeFlow.isEmpty()) {
        log.warn("TomTom flow segment for {} lacks speeds; using fallback", coordinate.toQueryValue());
        return fallback(coordinate);
      }
      boolean closed = JsonSupport.field(segment, "roadClosure").flatMap(JsonSupport::bool).orElse(false);
      double confidence =
          JsonSupport.number(JsonSupport.field(segment, "confidence").orElse(null)).orElse(1d);
      metrics.increment("source.traffic.live");
      return TrafficSample.live(
          coordinate, current.getAsDouble(), freeFlow.getAsDouble(), closed, confidence, clock.now());
    } catch (IOException ex) {
      log.warn("TomTom flow request for {} failed: {}", coordinate.toQueryValue(), ex.getMessage());
      return fallback(coordinate);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("TomTom flow request for {} interrupted", coordinate.toQueryValue());
      return fallback(coordinate);
    } catch (RuntimeException ex) {
      log.warn("TomTom flow response for {} could not be read", coordinate.toQueryValue(), ex);
      return fallback(coordinate);
    }
  }

  URI flowUri(Coordinate coordinate) {
    Map<String, String> params = UrlParts.params();
    params.put("key", apiKey);
    params.put("point", coordinate.toQueryValue());
    params.put("unit", "KMPH");
    return URI.create(baseUrl + FLOW_PATH + UrlParts.query(params));
  }

  private TrafficSample fallback(Coordinate coordinate) {
    metrics.increment("source.traffic.fallback");
    return TrafficSample.fallback(coordinate, clock.now());
  }
}
