package ai.drivewise.risk.infrastructure.http;

import ai.drivewise.risk.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link JsonHttpClient} on {@link HttpClient} with connect and request timeouts.
 * <p>URLs are logged with credential parameters masked; error bodies are truncated.</p>
 *
 * @since 0.1.0
 */
public final class JdkJsonHttpClient implements JsonHttpClient {
  private static final Logger log = LoggerFactory.getLogger(JdkJsonHttpClient.class);
  private static final int MAX_LOGGED_BODY_BYTES = 512;
  private static final String USER_AGENT = "drivewise-risk-engine";

  private final HttpClient client;
  private final Duration requestTimeout;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a client.
   *
   * @param requestTimeout connect and per-request timeout
   */
  public JdkJsonHttpClient(Duration requestTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout"))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), requestTimeout);
  }

  JdkJsonHttpClient(HttpClient client, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public Object getJson(URI uri) throws IOException, InterruptedException {
    String safeUrl = Logs.redactUrl(uri.toString());
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .header("User-Agent", USER_AGENT)
        .GET()
        .build();
    long started = System.nanoTime();
    HttpResponse<String> response =
        client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    log.debug("GET {} -> {} in {} ms", safeUrl, response.statusCode(),
        Duration.ofNanos(System.nanoTime() - started).toMillis());
    if (response.statusCode() < 200 || response.statusCode() > 299) {
      throw new HttpStatusException(response.statusCode(), "GET " + safeUrl + " returned "
          + response.statusCode() + ": " + Logs.truncate(response.body(), MAX_LOGGED_BODY_BYTES));
    }
    try {
      return json.parse(response.body());
    } catch (IllegalArgumentException ex) {
      throw new IOException("GET " + safeUrl + " returned malformed JSON", ex);
    }
  }
}
