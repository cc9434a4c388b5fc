package ai.drivewise.risk.infrastructure.http;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Streaming JSON parser producing plain maps and lists, plus lenient accessors for reading upstream payloads.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a complete JSON document.
   *
   * @param text JSON text
   * @return object graph of {@link Map}, {@link List}, {@link String}, {@link Number}, {@link Boolean} or
   *     {@code null}; an empty document yields an empty map
   * @throws IllegalArgumentException if the text is not valid JSON
   */
  public Object parse(String text) {
    Objects.requireNonNull(text, "text");
    try (JsonParser parser = factory.createParser(text)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        return Map.of();
      }
      Object value = read(parser, first);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after JSON document");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getMessage(), ex);
    }
  }

  private Object read(JsonParser parser, JsonToken token) throws IOException {
    switch (token) {
      case START_OBJECT:
        Map<String, Object> object = new LinkedHashMap<>();
        for (JsonToken next = parser.nextToken(); next != JsonToken.END_OBJECT; next = parser.nextToken()) {
          String field = parser.currentName();
          object.put(field, read(parser, parser.nextToken()));
        }
        return object;
      case START_ARRAY:
        List<Object> array = new ArrayList<>();
        for (JsonToken next = parser.nextToken(); next != JsonToken.END_ARRAY; next = parser.nextToken()) {
          array.add(read(parser, next));
        }
        return array;
      case VALUE_STRING:
        return parser.getText();
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return parser.getNumberValue();
      case VALUE_TRUE:
        return Boolean.TRUE;
      case VALUE_FALSE:
        return Boolean.FALSE;
      case VALUE_NULL:
        return null;
      default:
        throw new IllegalArgumentException("unexpected JSON token " + token);
    }
  }

  /**
   * Reads a field of a JSON object.
   *
   * @param node parsed node
   * @param field field name
   * @return field value; empty when {@code node} is not an object or the field is absent or null
   */
  public static Optional<Object> field(Object node, String field) {
    if (node instanceof Map<?, ?> map) {
      return Optional.ofNullable(map.get(field));
    }
    return Optional.empty();
  }

  /**
   * Follows a chain of object fields.
   *
   * @param node parsed node
   * @param path field names
   * @return value at the end of the chain
   */
  public static Optional<Object> path(Object node, String... path) {
    Optional<Object> current = Optional.ofNullable(node);
    for (String field : path) {
      current = current.flatMap(value -> field(value, field));
    }
    return current;
  }

  /**
   * Views a node as a list.
   *
   * @param node parsed node
   * @return list elements, or an empty list when {@code node} is not an array
   */
  public static List<Object> array(Object node) {
    if (node instanceof List<?> list) {
      return new ArrayList<>(list);
    }
    return List.of();
  }

  /**
   * Reads a number, accepting numeric strings such as NHTSA's {@code "5"}.
   *
   * @param node parsed node
   * @return numeric value; empty for non-numeric text such as {@code "Not Rated"}
   */
  public static OptionalDouble number(Object node) {
    if (node instanceof Number n) {
      return OptionalDouble.of(n.doubleValue());
    }
    if (node instanceof String s && !s.isBlank()) {
      try {
        double parsed = Double.parseDouble(s.trim());
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    }
    return OptionalDouble.empty();
  }

  /**
   * Reads a non-blank string; numbers are rendered as text.
   *
   * @param node parsed node
   * @return trimmed text
   */
  public static Optional<String> text(Object node) {
    if (node instanceof String s && !s.isBlank()) {
      return Optional.of(s.trim());
    }
    if (node instanceof Number n) {
      return Optional.of(n.toString());
    }
    return Optional.empty();
  }

  /**
   * Reads a boolean, accepting {@code "true"}/{@code "false"} text.
   *
   * @param node parsed node
   * @return boolean value
   */
  public static Optional<Boolean> bool(Object node) {
    if (node instanceof Boolean b) {
      return Optional.of(b);
    }
    if (node instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
      return Optional.of(Boolean.parseBoolean(s));
    }
    return Optional.empty();
  }
}
