package ca.gc.cra.ldiftap.api;

import ca.gc.cra.ldiftap.config.ConfigMerger;
import ca.gc.cra.ldiftap.config.DefaultsForMode;
import ca.gc.cra.ldiftap.config.TapConfig;
import ca.gc.cra.ldiftap.config.YamlConfigLoader;
import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration resolution shared by the {@code extract} and {@code discover} commands: CLI parsing, optional
 * YAML loading, merging with defaults, telemetry properties and {@link TapConfig} validation.
 */
final class TapCliSupport {
  private static final Logger log = LoggerFactory.getLogger(TapCliSupport.class);

  private TapCliSupport() {}

  /**
   * Outcome of configuration resolution: either a config or the exit code to return.
   *
   * @param config validated configuration when resolution succeeded
   * @param failure exit code when it did not
   */
  record Resolution(Optional<TapConfig> config, ExitCode failure) {
    static Resolution of(TapConfig config) {
      return new Resolution(Optional.of(config), ExitCode.SUCCESS);
    }

    static Resolution failed(ExitCode exitCode) {
      return new Resolution(Optional.empty(), exitCode);
    }
  }

  static Resolution resolve(String mode, CliInput input, String usage) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      return Resolution.of(TapConfig.fromMap(effective));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
  }

  static String describe(EntryFilterPolicy policy) {
    return "baseDn=" + policy.baseDnFilter().orElse("<any>")
        + ", objectClass=" + (policy.objectClassFilter().isEmpty()
            ? "<any>" : String.join(",", new TreeSet<>(policy.objectClassFilter())))
        + ", attributes=" + policy.attributeFilter()
            .map(names -> String.join(",", new TreeSet<>(names))).orElse("<all>")
        + ", exclude=" + (policy.excludeAttributes().isEmpty()
            ? "<none>" : String.join(",", new TreeSet<>(policy.excludeAttributes())))
        + ", operational=" + (policy.includeOperationalAttributes() ? "included" : "suppressed")
        + ", strict=" + policy.strictParsing();
  }
}
