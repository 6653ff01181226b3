package ca.gc.cra.ldiftap.config;

import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.validation.Net;
import ca.gc.cra.ldiftap.validation.Numbers;
import ca.gc.cra.ldiftap.validation.Paths;
import ca.gc.cra.ldiftap.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for one extraction or discovery run.
 * <p><strong>Why:</strong> Validates every input location, filter and output knob up front so a run never fails
 * halfway because of a typo.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param filePath optional single LDIF file
 * @param directoryPath optional directory scanned for files matching {@code filePattern}
 * @param filePattern glob applied to file names in {@code directoryPath}
 * @param encoding charset of the LDIF files
 * @param filterPolicy entry and attribute filters plus the strictness flag
 * @param maxFileSizeMb files larger than this many MiB are skipped
 * @param batchSize entries buffered per sink write
 * @param output entry destination
 * @param out NDJSON output file when {@code output=FILE}
 * @param kafkaBootstrap bootstrap servers when {@code output=KAFKA}
 * @param kafkaTopic destination topic when {@code output=KAFKA}
 * @param dryRun whether to stop after discovery
 * @since 0.1.0
 */
public record TapConfig(
    Optional<Path> filePath,
    Optional<Path> directoryPath,
    String filePattern,
    Charset encoding,
    EntryFilterPolicy filterPolicy,
    int maxFileSizeMb,
    int batchSize,
    OutputMode output,
    Optional<Path> out,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    boolean dryRun) {

  public static final String DEFAULT_FILE_PATTERN = "*.ldif";
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;
  public static final int DEFAULT_MAX_FILE_SIZE_MB = 100;
  public static final int MAX_FILE_SIZE_MB_LIMIT = 1000;
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int MAX_BATCH_SIZE = 10_000;
  public static final String DEFAULT_KAFKA_TOPIC = "ldif.entries";

  private static final long BYTES_PER_MIB = 1024L * 1024L;

  /**
   * Applies defaults and enforces cross-field invariants.
   *
   * @throws IllegalArgumentException if neither input path is present or the output is incomplete
   */
  public TapConfig {
    filePath = Objects.requireNonNullElse(filePath, Optional.empty());
    directoryPath = Objects.requireNonNullElse(directoryPath, Optional.empty());
    filePattern = Objects.requireNonNullElse(filePattern, DEFAULT_FILE_PATTERN);
    encoding = Objects.requireNonNullElse(encoding, DEFAULT_ENCODING);
    filterPolicy = Objects.requireNonNullElse(filterPolicy, EntryFilterPolicy.defaults());
    output = Objects.requireNonNullElse(output, OutputMode.STDOUT);
    out = Objects.requireNonNullElse(out, Optional.empty());
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.empty());
    kafkaTopic = Objects.requireNonNullElse(kafkaTopic, DEFAULT_KAFKA_TOPIC);

    if (filePath.isEmpty() && directoryPath.isEmpty()) {
      throw new IllegalArgumentException("filePath or directoryPath is required");
    }
    Numbers.requireRange("maxFileSizeMb", maxFileSizeMb, 1, MAX_FILE_SIZE_MB_LIMIT);
    Numbers.requireRange("batchSize", batchSize, 1, MAX_BATCH_SIZE);
    if (output == OutputMode.FILE && out.isEmpty()) {
      throw new IllegalArgumentException("out is required when output=FILE");
    }
    if (output == OutputMode.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when output=KAFKA");
    }
  }

  /**
   * Builds a configuration from flat {@code key=value} settings.
   *
   * @param args merged settings; blank values count as absent
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static TapConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Optional<Path> filePath = optionalString(args.get("filePath"))
        .map(value -> Paths.validateReadableFile("filePath", toPath("filePath", value)));
    Optional<Path> directoryPath = optionalString(args.get("directoryPath"))
        .map(value -> Paths.validateReadableDir("directoryPath", toPath("directoryPath", value)));
    String filePattern = optionalString(args.get("filePattern"))
        .map(value -> Strings.requireNonBlank("filePattern", value))
        .orElse(DEFAULT_FILE_PATTERN);
    Charset encoding = optionalString(args.get("encoding"))
        .map(TapConfig::parseCharset)
        .orElse(DEFAULT_ENCODING);

    List<String> attributeFilter = Strings.parseList("attributeFilter", args.get("attributeFilter"));
    List<String> excludeAttributes = Strings.parseList("excludeAttributes", args.get("excludeAttributes"));
    requireDisjoint(attributeFilter, excludeAttributes);
    Optional<String> operational = optionalString(args.get("operationalAttributes"));
    EntryFilterPolicy policy = new EntryFilterPolicy(
        optionalString(args.get("baseDnFilter")),
        Set.copyOf(Strings.parseList("objectClassFilter", args.get("objectClassFilter"))),
        attributeFilter.isEmpty() ? Optional.empty() : Optional.of(Set.copyOf(attributeFilter)),
        Set.copyOf(excludeAttributes),
        flag(args, "includeOperationalAttributes", false),
        operational.map(value -> Set.copyOf(Strings.parseList("operationalAttributes", value))).orElse(null),
        flag(args, "strictParsing", true));

    int maxFileSizeMb = optionalString(args.get("maxFileSizeMb"))
        .map(value -> Numbers.parseIntInRange("maxFileSizeMb", value, 1, MAX_FILE_SIZE_MB_LIMIT))
        .orElse(DEFAULT_MAX_FILE_SIZE_MB);
    int batchSize = optionalString(args.get("batchSize"))
        .map(value -> Numbers.parseIntInRange("batchSize", value, 1, MAX_BATCH_SIZE))
        .orElse(DEFAULT_BATCH_SIZE);

    OutputMode output = OutputMode.fromString(args.get("output"));
    Optional<Path> out = optionalString(args.get("out"))
        .map(value -> Paths.validateWritableFile("out", toPath("out", value)));
    Optional<String> kafkaBootstrap = optionalString(args.get("kafkaBootstrap"))
        .map(value -> Net.validateHostPortList("kafkaBootstrap", value));
    String kafkaTopic = optionalString(args.get("kafkaTopic"))
        .map(value -> Strings.sanitizeTopic("kafkaTopic", value))
        .orElse(DEFAULT_KAFKA_TOPIC);

    return new TapConfig(
        filePath,
        directoryPath,
        filePattern,
        encoding,
        policy,
        maxFileSizeMb,
        batchSize,
        output,
        out,
        kafkaBootstrap,
        kafkaTopic,
        flag(args, "dryRun", false));
  }

  /** Size limit in bytes derived from {@link #maxFileSizeMb()}. */
  public long maxFileSizeBytes() {
    return maxFileSizeMb * BYTES_PER_MIB;
  }

  private static void requireDisjoint(List<String> attributeFilter, List<String> excludeAttributes) {
    Set<String> allowed = new LinkedHashSet<>();
    for (String name : attributeFilter) {
      allowed.add(name.toLowerCase(Locale.ROOT));
    }
    Set<String> overlap = new LinkedHashSet<>();
    for (String name : excludeAttributes) {
      String folded = name.toLowerCase(Locale.ROOT);
      if (allowed.contains(folded)) {
        overlap.add(folded);
      }
    }
    if (!overlap.isEmpty()) {
      throw new IllegalArgumentException(
          "attributeFilter and excludeAttributes must not overlap: " + String.join(",", overlap));
    }
  }

  private static Charset parseCharset(String raw) {
    String name = Strings.requireNonBlank("encoding", raw);
    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException("encoding is not a supported charset: " + name, ex);
    }
  }

  private static Path toPath(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static boolean flag(Map<String, String> args, String key, boolean defaultValue) {
    return optionalString(args.get(key))
        .map(value -> Strings.parseBoolean(key, value))
        .orElse(defaultValue);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
