package ai.drivewise.risk.infrastructure.http;

import java.io.IOException;

/**
 * Non-2xx HTTP response.
 *
 * @since 0.1.0
 */
public final class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int status;

  /**
   * Creates the exception.
   *
   * @param status response status code
   * @param message description including the redacted URL
   */
  public HttpStatusException(int status, String message) {
    super(message);
    this.status = status;
  }

  /**
   * Response status code.
   *
   * @return HTTP status
   */
  public int status() {
    return status;
  }
}
