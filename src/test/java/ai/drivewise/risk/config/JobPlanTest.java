package ai.drivewise.risk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.drivewise.risk.application.schedule.JobKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobPlanTest {

  @Test
  void missingApiKeyDisablesTomTomJobs() {
    List<JobPlan> plan = JobPlan.of(EngineConfig.defaults());

    assertEquals(JobKind.values().length, plan.size());
    assertFalse(find(plan, JobKind.TRAFFIC_SWEEP).enabled());
    assertFalse(find(plan, JobKind.FULL_PIPELINE).enabled());
    assertEquals("tomtomApiKey not set", find(plan, JobKind.TRAFFIC_SWEEP).note());
    assertFalse(find(plan, JobKind.VEHICLE_SWEEP).enabled());
    assertTrue(find(plan, JobKind.MODEL_REFRESH).enabled());
  }

  @Test
  void configuredSourcesEnableEveryJob() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "tomtomApiKey", "abc",
        "vehicles", "2020:Honda:Civic",
        "regions", "Toronto:43.65,-79.38"));

    List<JobPlan> plan = JobPlan.of(config);

    assertTrue(plan.stream().allMatch(JobPlan::enabled));
    assertEquals("1 vehicles", find(plan, JobKind.VEHICLE_SWEEP).note());
    assertTrue(find(plan, JobKind.TRAFFIC_SWEEP).note().startsWith("1 regions"));
  }

  private static JobPlan find(List<JobPlan> plan, JobKind kind) {
    return plan.stream().filter(p -> p.kind() == kind).findFirst().orElseThrow();
  }
}
