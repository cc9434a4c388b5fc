package ai.drivewise.risk.infrastructure.persistence;

import ai.drivewise.risk.domain.geo.Coordinate;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Serializes engine records to compact single-line JSON shared by the NDJSON and Kafka sinks.
 *
 * <p>Every document carries {@code schemaVersion} and {@code type}. Absent optional values are written as
 * {@code null}.</p>
 *
 * @since 0.1.0
 */
public final class RecordJsonWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes a traffic sample.
   *
   * @param sample sample to encode
   * @return UTF-8 JSON
   */
  public byte[] traffic(TrafficSample sample) {
    return write("traffic", gen -> {
      gen.writeStringField("sampleId", sample.sampleId());
      writeCoordinate(gen, sample.coordinate());
      gen.writeNumberField("currentSpeed", sample.currentSpeed());
      gen.writeNumberField("freeFlowSpeed", sample.freeFlowSpeed());
      gen.writeNumberField("congestionLevel", sample.congestionLevel());
      gen.writeBooleanField("roadClosed", sample.roadClosed());
      gen.writeNumberField("confidence", sample.confidence());
      gen.writeStringField("collectedAt", sample.collectedAt().toString());
      gen.writeStringField("source", sample.sourceTag().name());
    });
  }

  /**
   * Encodes an incident.
   *
   * @param incident incident to encode
   * @return UTF-8 JSON
   */
  public byte[] incident(Incident incident) {
    return write("incident", gen -> {
      gen.writeStringField("id", incident.id());
      gen.writeNumberField("category", incident.category());
      gen.writeStringField("description", incident.description());
      gen.writeNumberField("severity", incident.severity());
      writeCoordinate(gen, incident.coordinate());
      gen.writeNumberField("delaySeconds", incident.delaySeconds());
      gen.writeStringField("road", incident.roadNumber());
      gen.writeStringField("collectedAt", incident.collectedAt().toString());
    });
  }

  /**
   * Encodes a vehicle safety record.
   *
   * @param record record to encode
   * @return UTF-8 JSON
   */
  public byte[] vehicle(VehicleSafetyRecord record) {
    return write("vehicle", gen -> {
      gen.writeStringField("recordId", record.recordId());
      gen.writeStringField("key", record.key());
      gen.writeStringField("make", record.make());
      gen.writeStringField("model", record.model());
      gen.writeNumberField("year", record.year());
      gen.writeStringField("vin", record.vin().orElse(null));
      writeStars(gen, "overallRating", record.overallRating());
      writeStars(gen, "rolloverRating", record.rolloverRating());
      writeStars(gen, "frontalRating", record.frontalRating());
      writeStars(gen, "sideRating", record.sideRating());
      gen.writeNumberField("recallCount", record.recallCount());
      gen.writeStringField("description", record.vehicleDescription());
      if (record.ratingsVehicleId().isPresent()) {
        gen.writeNumberField("ratingsVehicleId", record.ratingsVehicleId().getAsLong());
      } else {
        gen.writeNullField("ratingsVehicleId");
      }
      gen.writeNumberField("premiumAdjustment", record.impact().premiumAdjustment());
      gen.writeNumberField("safetyScoreBoost", record.impact().safetyScoreBoost());
      gen.writeStringField("collectedAt", record.collectedAt().toString());
      gen.writeStringField("source", record.sourceTag().name());
    });
  }

  /**
   * Encodes a risk score.
   *
   * @param score score to encode
   * @return UTF-8 JSON
   */
  public byte[] riskScore(RiskScore score) {
    return write("risk_score", gen -> {
      gen.writeStringField("subjectId", score.subjectId());
      gen.writeNumberField("overall", score.overall());
      gen.writeNumberField("confidence", score.confidence());
      gen.writeObjectFieldStart("breakdown");
      for (Map.Entry<String, Double> entry : score.breakdown().entrySet()) {
        gen.writeNumberField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeStringField("trafficSampleId", score.inputs().trafficSampleId().orElse(null));
      gen.writeStringField("vehicleRecordId", score.inputs().vehicleRecordId().orElse(null));
      gen.writeStringField("trafficProvenance", score.provenance().traffic().name());
      gen.writeStringField("vehicleProvenance", score.provenance().vehicle().name());
      gen.writeStringField("computedAt", score.computedAt().toString());
    });
  }

  /**
   * Encodes a model-refresh trigger.
   *
   * @param procedure procedure name
   * @param requestedAt trigger time
   * @return UTF-8 JSON
   */
  public byte[] modelRefresh(String procedure, Instant requestedAt) {
    return write("model_refresh", gen -> {
      gen.writeStringField("procedure", procedure);
      gen.writeStringField("requestedAt", requestedAt.toString());
    });
  }

  private byte[] write(String type, Body body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", type);
      body.write(gen);
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to encode " + type + " record", ex);
    }
    return out.toByteArray();
  }

  private static void writeCoordinate(JsonGenerator gen, Coordinate coordinate) throws IOException {
    gen.writeNumberField("lat", coordinate.latitude());
    gen.writeNumberField("lon", coordinate.longitude());
  }

  private static void writeStars(JsonGenerator gen, String field, OptionalInt stars) throws IOException {
    if (stars.isPresent()) {
      gen.writeNumberField(field, stars.getAsInt());
    } else {
      gen.writeNullField(field);
    }
  }

  @FunctionalInterface
  private interface Body {
    void write(JsonGenerator gen) throws IOException;
  }
}
