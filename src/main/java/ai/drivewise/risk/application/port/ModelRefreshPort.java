package ai.drivewise.risk.application.port;

/**
 * Collaborator that recomputes downstream models from the persisted signals.
 *
 * @since 0.1.0
 */
public interface ModelRefreshPort extends AutoCloseable {
  /**
   * Triggers a named refresh procedure such as {@code update_risk_scores}.
   *
   * @param procedure procedure name
   * @throws SinkException if the trigger cannot be delivered
   */
  void trigger(String procedure) throws SinkException;

  @Override
  default void close() throws SinkException {}
}
