package ai.drivewise.risk.infrastructure.http;

import java.io.IOException;
import java.net.URI;

/**
 * Minimal GET-and-parse client used by the upstream source adapters.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface JsonHttpClient {
  /**
   * Fetches {@code uri} and parses the body as JSON.
   *
   * @param uri absolute URL, possibly carrying an API key
   * @return parsed document: maps, lists, strings, numbers, booleans or {@code null}
   * @throws IOException on transport failure, non-2xx status ({@link HttpStatusException}) or malformed JSON
   * @throws InterruptedException if interrupted while waiting for the response
   */
  Object getJson(URI uri) throws IOException, InterruptedException;
}
