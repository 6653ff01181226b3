package ca.gc.cra.ldiftap.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings into one flat map with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param mode CLI mode, used in diagnostics
   * @param yaml settings loaded from YAML, when a config file was given
   * @param cli settings from the command line
   * @param defaults mode defaults
   * @param warn receives a message for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException if cross-key requirements are not met
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (trim(effective.get("filePath")).isEmpty() && trim(effective.get("directoryPath")).isEmpty()) {
      throw new IllegalArgumentException("filePath or directoryPath is required for " + mode);
    }
    String output = trim(effective.get("output"));
    if (output.equalsIgnoreCase("kafka") && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when output=KAFKA");
    }
    if (output.equalsIgnoreCase("file") && trim(effective.get("out")).isEmpty()) {
      throw new IllegalArgumentException("out is required when output=FILE");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
