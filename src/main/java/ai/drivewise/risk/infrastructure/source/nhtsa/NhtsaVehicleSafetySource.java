package ai.drivewise.risk.infrastructure.source.nhtsa;

import ai.drivewise.risk.application.port.ClockPort;
import ai.drivewise.risk.application.port.MetricsPort;
import ai.drivewise.risk.application.port.VehicleSafetySource;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonSupport;
import ai.drivewise.risk.infrastructure.source.UrlParts;
import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link VehicleSafetySource} backed by the NHTSA 5-Star Safety Ratings API.
 * <p><strong>Lookup:</strong> VIN-only queries are decoded through vPIC {@code DecodeVin} first. The model-year
 * endpoint yields a {@code VehicleId}; the vehicle endpoint yields the ratings and description.</p>
 * <p><strong>Recalls:</strong> The recall count is the number of campaigns {@link NhtsaRecallClient} lists for the
 * resolved make, model and year. If that lookup fails the ratings payload's {@code RecallsCount} is kept and
 * {@code source.recalls.error} is counted; the rating tier is not affected.</p>
 * <p><strong>Tiers:</strong>
 * <ul>
 *   <li>{@link VehicleSourceTag#LIVE}: a numeric overall rating between 1 and 5.</li>
 *   <li>{@link VehicleSourceTag#DEFAULT}: no matching vehicle, an undecodable VIN, or an overall rating that is
 *       absent, {@code "Not Rated"} or out of range.</li>
 *   <li>{@link VehicleSourceTag#ERROR_FALLBACK}: transport failure, non-2xx status or unreadable payload.</li>
 * </ul>
 * <p><strong>Observability:</strong> {@code source.vehicle.live|default|error}.</p>
 *
 * @since 0.1.0
 */
public final class NhtsaVehicleSafetySource implements VehicleSafetySource {
  private static final Logger log = LoggerFactory.getLogger(NhtsaVehicleSafetySource.class);

  private final JsonHttpClient http;
  private final URI ratingsBaseUrl;
  private final URI vpicBaseUrl;
  private final NhtsaRecallClient recalls;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the source.
   *
   * @param http JSON client
   * @param ratingsBaseUrl ratings API base, e.g. {@code https://api.nhtsa.gov/SafetyRatings}
   * @param vpicBaseUrl VIN decoder base, e.g. {@code https://vpic.nhtsa.dot.gov/api/vehicles}
   * @param recallsBaseUrl recalls API base, e.g. {@code https://api.nhtsa.gov/recalls}
   * @param clock clock for record timestamps
   * @param metrics metrics sink
   */
  public NhtsaVehicleSafetySource(
      JsonHttpClient http,
      URI ratingsBaseUrl,
      URI vpicBaseUrl,
      URI recallsBaseUrl,
      ClockPort clock,
      MetricsPort metrics) {
    this.http = Objects.requireNonNull(http, "http");
    this.ratingsBaseUrl = Objects.requireNonNull(ratingsBaseUrl, "ratingsBaseUrl");
    this.vpicBaseUrl = Objects.requireNonNull(vpicBaseUrl, "vpicBaseUrl");
    this.recalls = new NhtsaRecallClient(this.http, Objects.requireNonNull(recallsBaseUrl, "recallsBaseUrl"));
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public VehicleSafetyRecord rate(VehicleQuery query) {
    Objects.requireNonNull(query, "query");
    try {
      Optional<VehicleQuery> resolved = query.needsDecode() ? decode(query) : Optional.of(query);
      if (resolved.isEmpty()) {
        log.info("VIN {} could not be decoded; using default rating", query.vin().orElse("?"));
        return substitute(query, VehicleSourceTag.DEFAULT, 0);
      }
      return lookup(resolved.get());
    } catch (IOException ex) {
      log.warn("NHTSA lookup for {} failed: {}", query.key(), ex.getMessage());
      return substitute(query, VehicleSourceTag.ERROR_FALLBACK, 0);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("NHTSA lookup for {} interrupted", query.key());
      return substitute(query, VehicleSourceTag.ERROR_FALLBACK, 0);
    } catch (RuntimeException ex) {
      log.warn("NHTSA response for {} could not be read", query.key(), ex);
      return substitute(query, VehicleSourceTag.ERROR_FALLBACK, 0);
    }
  }

  private VehicleSafetyRecord lookup(VehicleQuery query) throws IOException, InterruptedException {
    Object models = http.getJson(modelYearUri(query));
    List<Object> matches = JsonSupport.array(JsonSupport.field(models, "Results").orElse(null));
    OptionalDouble vehicleId = matches.isEmpty()
        ? OptionalDouble.empty()
        : JsonSupport.number(JsonSupport.field(matches.get(0), "VehicleId").orElse(null));
    if (vehicleId.isEmpty()) {
      log.info("No NHTSA ratings for {} {} {}; using default rating", query.year(), query.make(), query.model());
      return substitute(query, VehicleSourceTag.DEFAULT, recallCount(query, 0));
    }

    long id = (long) vehicleId.getAsDouble();
    Object details = http.getJson(vehicleUri(id));
    List<Object> results = JsonSupport.array(JsonSupport.field(details, "Results").orElse(null));
    if (results.isEmpty()) {
      log.info("NHTSA vehicle {} has no rating details; using default rating", id);
      return substitute(query, VehicleSourceTag.DEFAULT, recallCount(query, 0));
    }
    Object rating = results.get(0);
    int reported = (int) Math.max(0d, JsonSupport.number(JsonSupport.field(rating, "RecallsCount").orElse(null))
        .orElse(0));
    int recallCount = recallCount(query, reported);
    OptionalInt overall = stars(rating, "OverallRating");
    if (overall.isEmpty()) {
      log.info("NHTSA vehicle {} is not rated overall; using default rating", id);
      return substitute(query, VehicleSourceTag.DEFAULT, recallCount);
    }

    metrics.increment("source.vehicle.live");
    return new VehicleSafetyRecord(
        VehicleSafetyRecord.newId(),
        query.make(),
        query.model(),
        query.year(),
        query.vin(),
        overall,
        stars(rating, "RolloverRating"),
        firstStars(rating, "OverallFrontCrashRating", "FrontalCrashRating"),
        firstStars(rating, "OverallSideCrashRating", "SideCrashRating"),
        recallCount,
        JsonSupport.field(rating, "VehicleDescription").flatMap(JsonSupport::text).orElse(""),
        OptionalLong.of(id),
        clock.now(),
        VehicleSourceTag.LIVE);
  }

  private int recallCount(VehicleQuery query, int reported) throws InterruptedException {
    try {
      int listed = recalls.byVehicle(query).size();
      metrics.increment("source.recalls.live");
      return listed;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("source.recalls.error");
      log.info("NHTSA recalls for {} {} {} unavailable ({}); keeping reported count {}",
          query.year(), query.make(), query.model(), ex.getMessage(), reported);
      return reported;
    }
  }

  private Optional<VehicleQuery> decode(VehicleQuery query) throws IOException, InterruptedException {
    String vin = query.vin().orElseThrow(() -> new IllegalArgumentException("VIN required for decoding"));
    Object body = http.getJson(decodeUri(vin));
    Map<String, String> variables = new HashMap<>();
    for (Object entry : JsonSupport.array(JsonSupport.field(body, "Results").orElse(null))) {
      Optional<String> name = JsonSupport.field(entry, "Variable").flatMap(JsonSupport::text);
      Optional<String> value = JsonSupport.field(entry, "Value").flatMap(JsonSupport::text);
      if (name.isPresent() && value.isPresent()) {
        variables.put(name.get(), value.get());
      }
    }
    String make = variables.getOrDefault("Make", "");
    String model = variables.getOrDefault("Model", "");
    OptionalDouble year = JsonSupport.number(variables.get("Model Year"));
    if (make.isEmpty() || model.isEmpty() || year.isEmpty() || year.getAsDouble() < 1) {
      return Optional.empty();
    }
    return Optional.of(new VehicleQuery((int) year.getAsDouble(), make, model, query.vin()));
  }

  URI modelYearUri(VehicleQuery query) {
    return URI.create(ratingsBaseUrl + "/modelyear/" + query.year()
        + "/make/" + UrlParts.segment(query.make())
        + "/model/" + UrlParts.segment(query.model())
        + UrlParts.query(Map.of("format", "json")));
  }

  URI vehicleUri(long vehicleId) {
    return URI.create(ratingsBaseUrl + "/VehicleId/" + vehicleId + UrlParts.query(Map.of("format", "json")));
  }

  URI decodeUri(String vin) {
    return URI.create(vpicBaseUrl + "/DecodeVin/" + UrlParts.segment(vin) + UrlParts.query(Map.of("format", "json")));
  }

  static OptionalInt stars(Object node, String field) {
    OptionalDouble value = JsonSupport.number(JsonSupport.field(node, field).orElse(null));
    if (value.isEmpty()) {
      return OptionalInt.empty();
    }
    long rounded = Math.round(value.getAsDouble());
    return rounded >= 1 && rounded <= 5 ? OptionalInt.of((int) rounded) : OptionalInt.empty();
  }

  private static OptionalInt firstStars(Object node, String primary, String secondary) {
    OptionalInt value = stars(node, primary);
    return value.isPresent() ? value : stars(node, secondary);
  }

  private VehicleSafetyRecord substitute(VehicleQuery query, VehicleSourceTag tag, int recalls) {
    metrics.increment(tag == VehicleSourceTag.DEFAULT ? "source.vehicle.default" : "source.vehicle.error");
    return VehicleSafetyRecord.substitute(query, tag, recalls, clock.now());
  }
}
