package ca.gc.cra.ldiftap.domain.ldif;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Accumulates the attributes of one in-progress LDIF entry.
 * <p><strong>Why:</strong> Applies attribute-level filters as each value arrives so excluded data is never held,
 * while still deriving {@code objectClass} and {@code changeType} from every line.</p>
 * <p><strong>Role:</strong> Domain helper exclusively owned by a parser for the lifetime of one entry.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single owner.</p>
 *
 * @since 0.1.0
 */
public final class EntryAssembler {
  private static final Logger log = LoggerFactory.getLogger(EntryAssembler.class);
  private static final String OBJECT_CLASS = "objectclass";
  private static final String CHANGE_TYPE = "changetype";

  private final EntryFilterPolicy policy;
  private final String sourceFile;
  private final int lineNumber;
  private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
  private final List<String> objectClass = new ArrayList<>();
  private String dn = "";
  private String changeType;
  private long entrySize;

  /**
   * Starts a new entry at the given DN line.
   *
   * @param policy filter policy; must not be {@code null}
   * @param sourceFile file the entry is read from
   * @param lineNumber 1-based line number of the DN line
   */
  public EntryAssembler(EntryFilterPolicy policy, String sourceFile, int lineNumber) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
    this.lineNumber = lineNumber;
  }

  /**
   * Sets the distinguished name; surrounding whitespace, Unicode spaces included, is removed.
   *
   * @param value DN text, possibly empty
   */
  public void dn(String value) {
    this.dn = value == null ? "" : value.strip();
  }

  public String dn() {
    return dn;
  }

  public int lineNumber() {
    return lineNumber;
  }

  /**
   * Adds the encoded byte length of a raw line that belongs to this entry.
   *
   * @param bytes byte count including the line terminator
   */
  public void addBytes(long bytes) {
    entrySize += bytes;
  }

  /**
   * Records one attribute value.
   *
   * @param attributeName attribute name as written in the file
   * @param value decoded value
   * @return {@code true} if the value was stored, {@code false} if a filter discarded it
   */
  public boolean add(String attributeName, String value) {
    Objects.requireNonNull(value, "value");
    String name = attributeName.toLowerCase(Locale.ROOT);
    if (OBJECT_CLASS.equals(name)) {
      objectClass.add(value);
    } else if (CHANGE_TYPE.equals(name)) {
      changeType = value;
    }
    if (!policy.acceptsAttribute(name)) {
      log.debug("Discarding attribute {} of entry at line {}", name, lineNumber);
      return false;
    }
    AttributeValue existing = attributes.get(name);
    attributes.put(name, existing == null ? AttributeValue.of(value) : existing.append(value));
    return true;
  }

  /**
   * Builds the finalized entry. Entry-level filters are not applied here.
   *
   * @return the entry, or empty when no DN was captured
   */
  public Optional<LdifEntry> build() {
    if (dn.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new LdifEntry(
        dn,
        attributes,
        objectClass,
        Optional.ofNullable(changeType),
        sourceFile,
        lineNumber,
        entrySize));
  }
}
