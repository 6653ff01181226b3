package ca.gc.cra.ldiftap.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation and list parsing helpers for configuration values.
 * <p><strong>Why:</strong> Keeps control characters out of paths, topics and filter names, and gives every
 * comma-separated setting the same parsing rules.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures the value is present, not blank and free of control characters.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws IllegalArgumentException if blank or containing control characters
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name parameter name used in diagnostics
   * @param topic candidate topic
   * @return sanitized topic
   * @throws IllegalArgumentException if the topic contains characters Kafka rejects
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures the value is non-blank printable ASCII no longer than {@code maxLength}.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param maxLength maximum allowed length
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or has non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming items and dropping empty ones.
   *
   * @param name parameter name used in diagnostics
   * @param raw list text; {@code null} or blank yields an empty list
   * @return items in declaration order
   * @throws IllegalArgumentException if an item contains control characters
   */
  public static List<String> parseList(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (String part : raw.split(",")) {
      String item = part.trim();
      if (item.isEmpty()) {
        continue;
      }
      if (containsControl(item)) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
      items.add(item);
    }
    return List.copyOf(items);
  }

  /**
   * Parses a boolean flag, accepting {@code true/false/yes/no/1/0} case-insensitively.
   *
   * @param name parameter name used in diagnostics
   * @param raw textual value
   * @return parsed flag
   * @throws IllegalArgumentException if the value is not a recognised boolean
   */
  public static boolean parseBoolean(String name, String raw) {
    String value = requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + raw + ")"));
    };
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
