package ai.drivewise.risk.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation for upstream base URLs and Kafka bootstrap lists.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final Pattern HOSTNAME =
      Pattern.compile("^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
          + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");
  private static final Pattern IPV6_LITERAL = Pattern.compile("^\\[[0-9A-Fa-f:.]+]$");

  private Net() {}

  /**
   * Validates an http(s) base URL and strips a trailing slash.
   *
   * @param name option name used in error messages
   * @param value URL text
   * @return normalized URI without trailing slash
   */
  public static URI validateHttpUrl(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + ex.getMessage(), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + trimmed + ")");
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException(name + " must include a host (was " + trimmed + ")");
    }
    if (uri.getQuery() != null || uri.getFragment() != null) {
      throw new IllegalArgumentException(name + " must not include a query or fragment");
    }
    return trimmed.endsWith("/") ? URI.create(trimmed.substring(0, trimmed.length() - 1)) : uri;
  }

  /**
   * Validates one {@code host:port} pair; IPv6 hosts use brackets.
   *
   * @param value pair to check
   * @return normalized pair
   */
  public static String validateHostPort(String value) {
    String trimmed = Strings.requireNonBlank("host:port", value);
    int colon = trimmed.lastIndexOf(':');
    if (colon <= 0 || colon == trimmed.length() - 1) {
      throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + trimmed + ")");
    }
    String host = trimmed.substring(0, colon);
    String portText = trimmed.substring(colon + 1);
    if (host.startsWith("[")) {
      if (!IPV6_LITERAL.matcher(host).matches()) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } else if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 host must be wrapped in [ ] (was " + trimmed + ")");
    } else if (!HOSTNAME.matcher(host).matches()) {
      throw new IllegalArgumentException("invalid host: " + host);
    }
    int port;
    try {
      port = Integer.parseInt(portText);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portText + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return host + ':' + port;
  }

  /**
   * Validates a comma-separated Kafka bootstrap list.
   *
   * @param value list such as {@code broker1:9092,broker2:9092}
   * @return normalized list
   */
  public static String validateBootstrapServers(String value) {
    List<String> servers = new ArrayList<>();
    for (String part : Strings.requireNonBlank("kafkaBootstrap", value).split(",")) {
      if (!part.isBlank()) {
        servers.add(validateHostPort(part));
      }
    }
    if (servers.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return String.join(",", servers);
  }
}
