package ai.drivewise.risk.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Helpers for keeping upstream payloads and credentials out of log lines.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  static final String REDACTED = "[REDACTED]";
  private static final Pattern SECRET_QUERY_PARAM =
      Pattern.compile("(?i)([?&](?:key|api_?key|token|access_token)=)[^&#\\s]*");

  private Logs() {}

  /**
   * Truncates {@code value} to at most {@code maxBytes} UTF-8 bytes without splitting a character.
   *
   * @param value text to bound; {@code null} yields {@code <null>}
   * @param maxBytes byte budget; must be positive
   * @return original text or a truncated copy with a suffix noting the original size
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String head;
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      head = chars.toString();
    } catch (CharacterCodingException ex) {
      head = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return head + "... (" + bytes.length + " bytes)";
  }

  /**
   * Masks credential query parameters such as TomTom's {@code key=} in a URL.
   *
   * @param url URL or log text; {@code null} yields {@code <null>}
   * @return text with secret parameter values replaced
   */
  public static String redactUrl(String url) {
    if (url == null) {
      return NULL_PLACEHOLDER;
    }
    return SECRET_QUERY_PARAM.matcher(url).replaceAll("$1" + REDACTED);
  }

  /**
   * Replaces a secret entirely.
   *
   * @param secret secret value
   * @return {@code [REDACTED]}, or {@code <unset>} when the secret is blank
   */
  public static String redact(String secret) {
    return secret == null || secret.isBlank() ? "<unset>" : REDACTED;
  }
}
