package ca.gc.cra.ldiftap.domain.ldif;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Finalized directory entry parsed from an LDIF file.
 * <p><strong>Why:</strong> Gives sinks a fully assembled and filtered entry; partially decoded or partially
 * filtered entries never leave the parser.</p>
 * <p><strong>Role:</strong> Domain value flowing from the parser to {@code EntrySinkPort} adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable; attribute values are frozen on construction.</p>
 *
 * @param dn distinguished name; never blank
 * @param attributes lower-cased attribute names mapped to their values, in first-seen order. Base64 ({@code ::})
 *     values that decode to valid UTF-8 hold the decoded text; any other binary payload holds its canonical base64
 *     text, so the original bytes of such a value are recovered by decoding it again.
 * @param objectClass object classes in file order, collected regardless of attribute filters
 * @param changeType value of the {@code changetype} attribute when present
 * @param sourceFile path of the file the entry was read from
 * @param lineNumber 1-based line number of the entry's DN line
 * @param entrySize encoded byte length of every line belonging to the entry, terminators included
 * @since 0.1.0
 */
public record LdifEntry(
    String dn,
    Map<String, AttributeValue> attributes,
    List<String> objectClass,
    Optional<String> changeType,
    String sourceFile,
    int lineNumber,
    long entrySize) {

  /** Record key for the distinguished name. */
  public static final String KEY_DN = "dn";
  /** Record key for the attribute map. */
  public static final String KEY_ATTRIBUTES = "attributes";
  /** Record key for the object-class list. */
  public static final String KEY_OBJECT_CLASS = "object_class";
  /** Record key for the change type. */
  public static final String KEY_CHANGE_TYPE = "change_type";
  /** Record key for the source file path. */
  public static final String KEY_SOURCE_FILE = "source_file";
  /** Record key for the DN line number. */
  public static final String KEY_LINE_NUMBER = "line_number";
  /** Record key for the entry byte size. */
  public static final String KEY_ENTRY_SIZE = "entry_size";

  public LdifEntry {
    Objects.requireNonNull(dn, "dn");
    if (dn.isBlank()) {
      throw new IllegalArgumentException("dn must not be blank");
    }
    Objects.requireNonNull(attributes, "attributes");
    Map<String, AttributeValue> frozen = new LinkedHashMap<>();
    attributes.forEach((name, value) -> frozen.put(name, value.freeze()));
    attributes = Collections.unmodifiableMap(frozen);
    objectClass = List.copyOf(Objects.requireNonNull(objectClass, "objectClass"));
    changeType = Objects.requireNonNullElse(changeType, Optional.empty());
    Objects.requireNonNull(sourceFile, "sourceFile");
    if (lineNumber < 1) {
      throw new IllegalArgumentException("lineNumber must be >= 1 (was " + lineNumber + ")");
    }
    if (entrySize < 0) {
      throw new IllegalArgumentException("entrySize must not be negative");
    }
  }

  /**
   * Looks up an attribute by name, case-insensitively.
   *
   * @param name attribute name
   * @return stored value when present
   */
  public Optional<AttributeValue> attribute(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(attributes.get(name.toLowerCase(Locale.ROOT)));
  }

  /**
   * Converts the entry to the record shape handed to sinks. Single-element attributes collapse to
   * plain strings; {@code object_class} is always a list.
   *
   * @return mutable ordered map owned by the caller
   */
  public Map<String, Object> toRecord() {
    Map<String, Object> attributeMap = new LinkedHashMap<>();
    attributes.forEach((name, value) -> attributeMap.put(name, value.toRecordValue()));

    Map<String, Object> record = new LinkedHashMap<>();
    record.put(KEY_DN, dn);
    record.put(KEY_ATTRIBUTES, attributeMap);
    record.put(KEY_OBJECT_CLASS, new ArrayList<>(objectClass));
    record.put(KEY_CHANGE_TYPE, changeType.orElse(null));
    record.put(KEY_SOURCE_FILE, sourceFile);
    record.put(KEY_LINE_NUMBER, lineNumber);
    record.put(KEY_ENTRY_SIZE, entrySize);
    return record;
  }
}
