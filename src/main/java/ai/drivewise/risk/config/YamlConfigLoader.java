package ai.drivewise.risk.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads engine configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>Nested mappings become dotted keys ({@code grid: {density: 3}} reads as {@code grid.density=3}). Sequences of
 * scalars, used for {@code regions} and {@code vehicles}, are joined with {@code ;} so they match the CLI form.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON, "run", "score", "route");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code run}, {@code score} or {@code route})
   * @return flat map of merged settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, mode));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  static Map<String, String> parse(Reader reader, String mode) {
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document = new Yaml().load(reader);
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : requireMapping(document, "document").entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException("unknown top-level section '" + entry.getKey()
            + "' (expected one of " + SECTIONS + ")");
      }
      sections.put(name, entry.getValue());
    }

    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON, section)) {
      Object body = sections.get(name);
      if (body != null) {
        collect("", requireMapping(body, name), settings);
      }
    }
    return Map.copyOf(settings);
  }

  private static Map<?, ?> requireMapping(Object node, String where) {
    if (node instanceof Map<?, ?> mapping) {
      return mapping;
    }
    throw new IllegalArgumentException(where + " must be a mapping");
  }

  private static void collect(String prefix, Map<?, ?> mapping, Map<String, String> settings) {
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("blank or non-text YAML key"
            + (prefix.isEmpty() ? "" : " under " + prefix));
      }
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(key, nested, settings);
      } else if (value instanceof Collection<?> items) {
        settings.put(key, joinScalars(key, items));
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    }
  }

  // regions and vehicles are ';'-separated on the command line.
  private static String joinScalars(String key, Collection<?> items) {
    List<String> parts = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Collection<?>) {
        throw new IllegalArgumentException(key + " must be a list of plain values");
      }
      if (item != null) {
        parts.add(item.toString().trim());
      }
    }
    return String.join(";", parts);
  }
}
