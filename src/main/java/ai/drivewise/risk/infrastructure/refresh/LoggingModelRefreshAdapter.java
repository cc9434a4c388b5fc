package ai.drivewise.risk.infrastructure.refresh;

import ai.drivewise.risk.application.port.ModelRefreshPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ModelRefreshPort} used when no trigger topic is configured: the request is only logged.
 *
 * @since 0.1.0
 */
public final class LoggingModelRefreshAdapter implements ModelRefreshPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingModelRefreshAdapter.class);

  @Override
  public void trigger(String procedure) {
    log.info("Model refresh requested for {} (no trigger sink configured)", Objects.requireNonNull(procedure));
  }
}
