package ai.drivewise.risk.application.port;

/**
 * Raised when a persistence sink rejects a batch.
 *
 * <p>Sink failures are job-level errors: the sweep that hit one reports it to the scheduler instead of marking
 * individual units failed.</p>
 *
 * @since 0.1.0
 */
public class SinkException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failed write
   * @param cause underlying failure
   */
  public SinkException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates the exception without a cause.
   *
   * @param message description of the failed write
   */
  public SinkException(String message) {
    super(message);
  }
}
