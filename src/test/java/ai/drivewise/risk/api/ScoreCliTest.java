package ai.drivewise.risk.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.drivewise.risk.application.pipeline.ScoreRequest;
import ai.drivewise.risk.config.CompositionRoot;
import ai.drivewise.risk.domain.risk.BehavioralFactors;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScoreCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void scoresBehaviourOnly() {
    ExitCode code = ScoreCli.run(
        new String[] {"subject=driver-1", "speeding=1", "sink=none", "metricsExporter=none"},
        Map.of(),
        CompositionRoot::new);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Risk score for driver-1: 0.2500"), out);
    assertTrue(out.contains("traffic signal   ABSENT"), out);
    assertTrue(out.contains("vehicle signal   ABSENT"), out);
  }

  @Test
  void missingSubjectIsInvalid() {
    ExitCode code = ScoreCli.run(new String[] {"speeding=0.3"}, Map.of(), CompositionRoot::new);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: drivewise score"));
  }

  @Test
  void wiringFailureIsConfigError() {
    ExitCode code = ScoreCli.run(
        new String[] {"subject=driver-1", "metricsExporter=none"},
        Map.of(),
        config -> {
          throw new IllegalStateException("no sink");
        });

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void extractRequestReadsSignals() {
    Map<String, String> kv = new LinkedHashMap<>();
    kv.put("subject", " driver-7 ");
    kv.put("hard_braking", "0.4");
    kv.put("lat", "37.77");
    kv.put("lon", "-122.42");
    kv.put("year", "2020");
    kv.put("make", "Toyota");
    kv.put("model", "Camry");
    kv.put("sink", "none");

    ScoreRequest request = ScoreCli.extractRequest(kv);

    assertEquals("driver-7", request.subjectId());
    assertEquals(0.4d, request.factors().clamped(BehavioralFactors.HARD_BRAKING), 1e-9);
    assertEquals(37.77d, request.location().orElseThrow().latitude(), 1e-9);
    VehicleQuery vehicle = request.vehicle().orElseThrow();
    assertEquals(2020, vehicle.year());
    assertEquals(Map.of("sink", "none"), kv);
  }

  @Test
  void extractRequestAcceptsVinOnly() {
    Map<String, String> kv = new LinkedHashMap<>(Map.of("subject", "d", "vin", "1HGCM82633A004352"));

    ScoreRequest request = ScoreCli.extractRequest(kv);

    assertTrue(request.vehicle().orElseThrow().needsDecode());
  }

  @Test
  void extractRequestRejectsPartialSignals() {
    assertThrows(IllegalArgumentException.class,
        () -> ScoreCli.extractRequest(new LinkedHashMap<>(Map.of("subject", "d", "lat", "1"))));
    assertThrows(IllegalArgumentException.class,
        () -> ScoreCli.extractRequest(new LinkedHashMap<>(Map.of("subject", "d", "year", "2020"))));
    assertThrows(IllegalArgumentException.class,
        () -> ScoreCli.extractRequest(new LinkedHashMap<>(Map.of("subject", "d", "speeding", "fast"))));
  }
}
