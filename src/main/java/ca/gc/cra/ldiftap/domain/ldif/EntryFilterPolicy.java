package ca.gc.cra.ldiftap.domain.ldif;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Inclusion and exclusion rules applied while LDIF entries are assembled.
 * <p><strong>Why:</strong> Lets operators narrow extraction to a subtree, to a set of object classes, or to a subset
 * of attributes without post-processing the emitted records.</p>
 * <p><strong>Role:</strong> Domain policy consulted by {@link EntryAssembler} per attribute value and by the parser
 * once per finalized entry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decide whether an attribute value is stored (allow-list, deny-list, operational deny-list).</li>
 *   <li>Decide whether a finalized entry is emitted (base DN suffix, object-class OR match).</li>
 *   <li>Carry the strict/lenient parsing flag.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across parsers.</p>
 *
 * @param baseDnFilter optional DN suffix; compared case-insensitively
 * @param objectClassFilter object classes of which at least one must be present; empty disables the filter
 * @param attributeFilter optional allow-list of attribute names; empty optional disables the filter
 * @param excludeAttributes attribute names never stored
 * @param includeOperationalAttributes whether names in {@code operationalAttributes} are stored
 * @param operationalAttributes server-managed attribute names suppressed unless explicitly included
 * @param strictParsing whether malformed input aborts the file instead of being skipped
 * @since 0.1.0
 */
public record EntryFilterPolicy(
    Optional<String> baseDnFilter,
    Set<String> objectClassFilter,
    Optional<Set<String>> attributeFilter,
    Set<String> excludeAttributes,
    boolean includeOperationalAttributes,
    Set<String> operationalAttributes,
    boolean strictParsing) {

  /** Operational attributes suppressed by default. */
  public static final Set<String> DEFAULT_OPERATIONAL_ATTRIBUTES = Set.of(
      "createtimestamp",
      "creatorsname",
      "modifytimestamp",
      "modifiersname",
      "structuralobjectclass",
      "governingstructurerule",
      "entrydn",
      "entryuuid",
      "entrycsn",
      "contextcsn",
      "pwdchangedtime",
      "pwdaccountlockedtime",
      "pwdfailuretime",
      "pwdhistory",
      "pwdgraceusetime");

  /**
   * Normalizes every name set to lower case and the base DN filter to a trimmed, lower-case suffix.
   */
  public EntryFilterPolicy {
    baseDnFilter = Objects.requireNonNullElse(baseDnFilter, Optional.<String>empty())
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .map(EntryFilterPolicy::fold);
    objectClassFilter = normalize(objectClassFilter);
    attributeFilter = Objects.requireNonNullElse(attributeFilter, Optional.<Set<String>>empty())
        .map(EntryFilterPolicy::normalize);
    excludeAttributes = normalize(excludeAttributes);
    operationalAttributes = operationalAttributes == null
        ? DEFAULT_OPERATIONAL_ATTRIBUTES
        : normalize(operationalAttributes);
  }

  /**
   * Returns a policy with no filters, default operational suppression and strict parsing.
   *
   * @return permissive default policy
   */
  public static EntryFilterPolicy defaults() {
    return new EntryFilterPolicy(
        Optional.empty(),
        Set.of(),
        Optional.empty(),
        Set.of(),
        false,
        DEFAULT_OPERATIONAL_ATTRIBUTES,
        true);
  }

  /**
   * Returns a copy with a different strictness flag.
   *
   * @param strict new strictness
   * @return adjusted policy
   */
  public EntryFilterPolicy withStrictParsing(boolean strict) {
    return new EntryFilterPolicy(
        baseDnFilter,
        objectClassFilter,
        attributeFilter,
        excludeAttributes,
        includeOperationalAttributes,
        operationalAttributes,
        strict);
  }

  /**
   * Decides whether a value of the named attribute is stored. The three checks are independent.
   *
   * @param attributeName attribute name; compared lower-cased
   * @return {@code true} when the value should be stored
   */
  public boolean acceptsAttribute(String attributeName) {
    String name = fold(attributeName);
    if (attributeFilter.isPresent() && !attributeFilter.get().contains(name)) {
      return false;
    }
    if (excludeAttributes.contains(name)) {
      return false;
    }
    return includeOperationalAttributes || !operationalAttributes.contains(name);
  }

  /**
   * Decides whether a finalized entry is emitted.
   *
   * @param entry finalized entry; must not be {@code null}
   * @return {@code true} when both the base DN and object-class filters pass
   */
  public boolean acceptsEntry(LdifEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (baseDnFilter.isPresent() && !fold(entry.dn()).endsWith(baseDnFilter.get())) {
      return false;
    }
    if (objectClassFilter.isEmpty()) {
      return true;
    }
    for (String objectClass : entry.objectClass()) {
      if (objectClassFilter.contains(fold(objectClass))) {
        return true;
      }
    }
    return false;
  }

  private static Set<String> normalize(Collection<String> names) {
    if (names == null || names.isEmpty()) {
      return Set.of();
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String name : names) {
      if (name == null) {
        continue;
      }
      String trimmed = name.trim();
      if (!trimmed.isEmpty()) {
        normalized.add(fold(trimmed));
      }
    }
    return Set.copyOf(normalized);
  }

  private static String fold(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
