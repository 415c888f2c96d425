package ca.gc.cra.formdata.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads one top-level section of a YAML file as dotted {@code key=value} pairs.
 * <p>Given
 * <pre>
 * formdata:
 *   file:
 *     contentType: text/plain
 *   maxDepth: 12
 * </pre>
 * section {@code formdata} yields {@code file.contentType=text/plain} and {@code maxDepth=12}. Documents are parsed
 * with SnakeYAML's {@link SafeConstructor}, so only plain maps, lists, and scalars are built.
 */
public final class YamlConfigLoader {
  /** Section read by {@link ConfigLoader#fromYaml(Path)}. */
  public static final String DEFAULT_SECTION = "formdata";

  private YamlConfigLoader() {}

  /**
   * Flattens {@code section} of the YAML file at {@code path}.
   *
   * @param path location of the YAML configuration
   * @param section top-level section name, matched case-insensitively
   * @return flat map (empty when the section is missing); empty optional when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, not a mapping, or contains lists
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String text = Files.readString(path, StandardCharsets.UTF_8);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping");
    }

    String wanted = section.trim().toLowerCase(Locale.ROOT);
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT).equals(wanted)) {
        collect(wanted, "", entry.getValue(), out);
        break;
      }
    }
    return Optional.of(Map.copyOf(out));
  }

  private static void collect(String where, String prefix, Object node, Map<String, String> out) {
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " contains a blank or non-string key");
      }
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        collect(dotted, dotted, value, out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + dotted);
      } else if (value != null) {
        out.put(dotted, value.toString());
      }
    }
  }
}
