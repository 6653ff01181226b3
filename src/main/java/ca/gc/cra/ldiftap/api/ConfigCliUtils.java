package ca.gc.cra.ldiftap.api;

import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the YAML config path given as {@code config=PATH}.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
