package ca.gc.cra.ldiftap.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default flat settings per CLI mode, used as the lowest-precedence layer by {@link ConfigMerger}.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a mode.
   *
   * @param mode {@code extract} or {@code discover}
   * @return immutable map of defaults
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "extract" -> buildExtractDefaults();
      case "discover" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("filePath", "");
    map.put("directoryPath", "");
    map.put("filePattern", TapConfig.DEFAULT_FILE_PATTERN);
    map.put("encoding", TapConfig.DEFAULT_ENCODING.name());
    map.put("maxFileSizeMb", Integer.toString(TapConfig.DEFAULT_MAX_FILE_SIZE_MB));
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("baseDnFilter", "");
    map.put("objectClassFilter", "");
    map.put("attributeFilter", "");
    map.put("excludeAttributes", "");
    map.put("operationalAttributes", "");
    map.put("includeOperationalAttributes", "false");
    map.put("strictParsing", "true");
    map.put("batchSize", Integer.toString(TapConfig.DEFAULT_BATCH_SIZE));
    map.put("output", OutputMode.STDOUT.name());
    map.put("out", "");
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", TapConfig.DEFAULT_KAFKA_TOPIC);
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }
}
