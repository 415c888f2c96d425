package ca.gc.cra.formdata.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link EncoderConfig} instances from configuration files.
 * <p><strong>Why:</strong> Lets applications override file defaults and the nesting limit without code changes.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Callers should log when configuration files are missing or malformed.</p>
 *
 * <p>Recognized keys: {@code file.contentType}, {@code file.filename}, {@code maxDepth}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  static final String KEY_CONTENT_TYPE = "file.contentType";
  static final String KEY_FILENAME = "file.filename";
  static final String KEY_MAX_DEPTH = "maxDepth";

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
  private static final Set<String> KNOWN_KEYS = Set.of(KEY_CONTENT_TYPE, KEY_FILENAME, KEY_MAX_DEPTH);

  private ConfigLoader() {}

  /**
   * Reads optional configuration properties from the given path.
   *
   * @param path properties file path; may be {@code null} or non-existent to use defaults
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value fails validation
   */
  public static EncoderConfig fromProperties(Path path) throws IOException {
    Properties props = new Properties();
    if (path != null && Files.exists(path)) {
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
    }
    Map<String, String> values = new HashMap<>();
    for (String key : props.stringPropertyNames()) {
      values.put(key, props.getProperty(key));
    }
    return fromMap(values);
  }

  /**
   * Reads the {@code formdata} section of a YAML document.
   *
   * @param path YAML file path; missing files yield defaults
   * @return configuration populated with YAML values overriding defaults
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or a value fails validation
   */
  public static EncoderConfig fromYaml(Path path) throws IOException {
    return fromMap(YamlConfigLoader.load(path, YamlConfigLoader.DEFAULT_SECTION).orElse(Map.of()));
  }

  /**
   * Builds a configuration from flat dotted keys, falling back to {@link EncoderConfig#defaults()}.
   *
   * @param values flat key/value map; unknown keys are logged at WARN and ignored
   * @return validated configuration
   * @throws IllegalArgumentException if a value fails validation
   */
  public static EncoderConfig fromMap(Map<String, String> values) {
    for (String key : values.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        log.warn("Ignoring unknown form-data config key '{}'", key);
      }
    }
    EncoderConfig defaults = EncoderConfig.defaults();
    String contentType = values.getOrDefault(KEY_CONTENT_TYPE, defaults.defaultFileContentType());
    String filename = values.getOrDefault(KEY_FILENAME, defaults.defaultFilename());
    String depth = values.get(KEY_MAX_DEPTH);
    int maxDepth;
    if (depth == null || depth.isBlank()) {
      maxDepth = defaults.maxDepth();
    } else {
      try {
        maxDepth = Integer.parseInt(depth.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(KEY_MAX_DEPTH + " must be an integer (was " + depth + ")", ex);
      }
    }
    return new EncoderConfig(contentType, filename, maxDepth);
  }
}
