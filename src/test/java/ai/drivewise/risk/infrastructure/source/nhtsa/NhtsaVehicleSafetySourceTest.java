package ai.drivewise.risk.infrastructure.source.nhtsa;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.domain.vehicle.VehicleSourceTag;
import ai.drivewise.risk.testutil.FakeJsonHttpClient;
import ai.drivewise.risk.testutil.MutableClock;
import ai.drivewise.risk.testutil.RecordingMetrics;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NhtsaVehicleSafetySourceTest {
  private static final URI RATINGS = URI.create("https://api.nhtsa.gov/SafetyRatings");
  private static final URI VPIC = URI.create("https://vpic.nhtsa.dot.gov/api/vehicles");
  private static final URI RECALLS = URI.create("https://api.nhtsa.gov/recalls");
  private static final String MODELS = """
      {"Count": 1, "Results": [{"VehicleDescription": "2020 Honda Civic 4 DR FWD", "VehicleId": 14577}]}
      """;
  private static final String DETAILS = """
      {"Count": 1, "Results": [{"OverallRating": "5", "OverallFrontCrashRating": "4",
        "OverallSideCrashRating": "5", "RolloverRating": "4", "RecallsCount": 2,
        "VehicleDescription": "2020 Honda Civic 4 DR FWD", "VehicleId": 14577}]}
      """;

  private FakeJsonHttpClient http;
  private RecordingMetrics metrics;
  private NhtsaVehicleSafetySource source;

  @BeforeEach
  void setUp() {
    http = new FakeJsonHttpClient();
    metrics = new RecordingMetrics();
    source = new NhtsaVehicleSafetySource(http, RATINGS, VPIC, RECALLS, new MutableClock(), metrics);
  }

  @Test
  void liveRatingIsReturnedWithAllStars() {
    http.respond("/modelyear/", MODELS).respond("/VehicleId/", DETAILS);

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(VehicleSourceTag.LIVE, record.sourceTag());
    assertEquals(5, record.overallRating().getAsInt());
    assertEquals(4, record.frontalRating().getAsInt());
    assertEquals(5, record.sideRating().getAsInt());
    assertEquals(4, record.rolloverRating().getAsInt());
    assertEquals(2, record.recallCount());
    assertEquals(14577L, record.ratingsVehicleId().getAsLong());
    assertEquals("2020 Honda Civic 4 DR FWD", record.vehicleDescription());
    assertEquals(1, metrics.count("source.vehicle.live"));
    assertEquals(1, metrics.count("source.recalls.error"));
  }

  @Test
  void listedRecallCampaignsReplaceTheReportedCount() {
    http.respond("/modelyear/", MODELS).respond("/VehicleId/", DETAILS).respond("/recallsByVehicle", """
        {"Count": 3, "results": [{"NHTSACampaignNumber": "20V001000"}, {"NHTSACampaignNumber": "21V002000"},
          {"NHTSACampaignNumber": "22V003000"}]}
        """);

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(VehicleSourceTag.LIVE, record.sourceTag());
    assertEquals(3, record.recallCount());
    assertEquals(1, metrics.count("source.recalls.live"));
    assertEquals(0, metrics.count("source.recalls.error"));
  }

  @Test
  void recallLookupFailureKeepsTheReportedCountAndTheLiveRating() {
    http.respond("/modelyear/", MODELS).respond("/VehicleId/", DETAILS)
        .fail("/recallsByVehicle", new IOException("HTTP 503"));

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(VehicleSourceTag.LIVE, record.sourceTag());
    assertEquals(2, record.recallCount());
    assertEquals(1, metrics.count("source.recalls.error"));
  }

  @Test
  void unratedVehicleStillReportsListedRecalls() {
    http.respond("/modelyear/", "{\"Count\": 0, \"Results\": []}")
        .respond("/recallsByVehicle", "{\"results\": [{\"NHTSACampaignNumber\": \"19V500000\"}]}");

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2018, "Geo", "Metro"));

    assertEquals(VehicleSourceTag.DEFAULT, record.sourceTag());
    assertEquals(1, record.recallCount());
  }

  @Test
  void modelLookupEncodesMakeAndModel() {
    URI uri = source.modelYearUri(VehicleQuery.of(2019, "Land Rover", "Range Rover"));

    assertEquals("/SafetyRatings/modelyear/2019/make/Land%20Rover/model/Range%20Rover", uri.getRawPath());
    assertEquals("format=json", uri.getQuery());
  }

  @Test
  void unknownVehicleGetsDefaultRating() {
    http.respond("/modelyear/", "{\"Count\": 0, \"Results\": []}");

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(1995, "Geo", "Metro"));

    assertEquals(VehicleSourceTag.DEFAULT, record.sourceTag());
    assertEquals(4, record.overallRating().getAsInt());
    assertEquals(1, metrics.count("source.vehicle.default"));
  }

  @Test
  void notRatedVehicleGetsDefaultRatingButKeepsRecalls() {
    http.respond("/modelyear/", MODELS).respond("/VehicleId/", """
        {"Results": [{"OverallRating": "Not Rated", "RecallsCount": 3}]}
        """);

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(VehicleSourceTag.DEFAULT, record.sourceTag());
    assertEquals(3, record.recallCount());
  }

  @Test
  void transportFailureGetsErrorFallback() {
    http.fail("/modelyear/", new IOException("connection reset"));

    VehicleSafetyRecord record = source.rate(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(VehicleSourceTag.ERROR_FALLBACK, record.sourceTag());
    assertEquals(3, record.overallRating().getAsInt());
    assertEquals(1, metrics.count("source.vehicle.error"));
  }

  @Test
  void vinIsDecodedBeforeLookup() {
    http.respond("/DecodeVin/", """
        {"Results": [{"Variable": "Make", "Value": "HONDA"}, {"Variable": "Model", "Value": "Civic"},
          {"Variable": "Model Year", "Value": "2020"}, {"Variable": "Trim", "Value": null}]}
        """).respond("/modelyear/", MODELS).respond("/VehicleId/", DETAILS);

    VehicleSafetyRecord record = source.rate(VehicleQuery.ofVin("2hgfc2f59lh000001"));

    assertEquals(VehicleSourceTag.LIVE, record.sourceTag());
    assertEquals(2020, record.year());
    assertEquals("HONDA", record.make());
    assertEquals(Optional.of("2HGFC2F59LH000001"), record.vin());
    assertEquals("2HGFC2F59LH000001", record.key());
    assertTrue(http.requests.get(0).getPath().endsWith("/DecodeVin/2HGFC2F59LH000001"));
  }

  @Test
  void undecodableVinGetsDefaultRating() {
    http.respond("/DecodeVin/", "{\"Results\": [{\"Variable\": \"Make\", \"Value\": \"\"}]}");

    VehicleSafetyRecord record = source.rate(VehicleQuery.ofVin("00000000000000000"));

    assertEquals(VehicleSourceTag.DEFAULT, record.sourceTag());
    assertEquals(1, http.requests.size());
  }

  @Test
  void starsRejectsOutOfRangeValues() {
    assertTrue(NhtsaVehicleSafetySource.stars(Map.of("OverallRating", "7"), "OverallRating").isEmpty());
    assertEquals(3, NhtsaVehicleSafetySource.stars(Map.of("OverallRating", 3), "OverallRating").getAsInt());
  }
}
