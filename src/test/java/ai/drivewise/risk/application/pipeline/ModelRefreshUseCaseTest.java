package ai.drivewise.risk.application.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.application.poll.CancellationSignal;
import ai.drivewise.risk.application.port.ModelRefreshPort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.testutil.RecordingMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ModelRefreshUseCaseTest {
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetrics();
  }

  @Test
  void triggersEveryProcedureInOrder() throws SinkException {
    List<String> triggered = new ArrayList<>();
    ModelRefreshPort port = triggered::add;

    int count = new ModelRefreshUseCase(port, metrics).run(new CancellationSignal());

    assertEquals(2, count);
    assertEquals(ModelRefreshUseCase.PROCEDURES, triggered);
    assertEquals(1, metrics.count("refresh.update_risk_scores.ok"));
  }

  @Test
  void attemptsAllProceduresBeforeFailing() {
    List<String> attempted = new ArrayList<>();
    ModelRefreshPort port = procedure -> {
      attempted.add(procedure);
      throw new SinkException("broker down for " + procedure);
    };

    SinkException ex = assertThrows(
        SinkException.class, () -> new ModelRefreshUseCase(port, metrics).run(new CancellationSignal()));

    assertEquals(ModelRefreshUseCase.PROCEDURES, attempted);
    assertEquals(1, ex.getSuppressed().length);
    assertEquals(1, metrics.count("refresh.update_safety_scores.error"));
  }

  @Test
  void stopsWhenCancelled() throws SinkException {
    CancellationSignal cancellation = new CancellationSignal();
    AtomicReference<String> last = new AtomicReference<>();
    ModelRefreshPort port = procedure -> {
      last.set(procedure);
      cancellation.cancel();
    };

    int count = new ModelRefreshUseCase(port, metrics).run(cancellation);

    assertEquals(1, count);
    assertEquals(ModelRefreshUseCase.UPDATE_RISK_SCORES, last.get());
  }
}
