package ai.drivewise.risk.infrastructure.source;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Encoding helpers for building upstream URLs.
 *
 * @since 0.1.0
 */
public final class UrlParts {
  private UrlParts() {}

  /**
   * Encodes one path segment; spaces become {@code %20}.
   *
   * @param segment raw segment such as {@code Grand Cherokee}
   * @return encoded segment
   */
  public static String segment(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  /**
   * Builds a query string from ordered parameters.
   *
   * @param params parameter names and raw values
   * @return {@code ?a=1&b=2}, or an empty string when there are no parameters
   */
  public static String query(Map<String, String> params) {
    if (params.isEmpty()) {
      return "";
    }
    StringJoiner joiner = new StringJoiner("&", "?", "");
    params.forEach((name, value) -> joiner.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return joiner.toString();
  }

  /**
   * Starts an ordered parameter map.
   *
   * @return mutable insertion-ordered map
   */
  public static Map<String, String> params() {
    return new LinkedHashMap<>();
  }
}
