package ca.gc.cra.ldiftap.domain.ldif;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Value stored under one attribute name of an LDIF entry, either a single string or an
 * ordered list of strings when the attribute repeats.
 * <p><strong>Why:</strong> Makes the "string or list" shape of directory attributes explicit so promotion from
 * one value to many is a named operation instead of a runtime type check.</p>
 * <p><strong>Role:</strong> Domain value carried inside {@link LdifEntry}.</p>
 * <p><strong>Thread-safety:</strong> {@link Single} is immutable. A {@link Multi} created by {@link #append(String)}
 * is owned by the {@link EntryAssembler} that built it until {@link #freeze()} is called; frozen values are
 * immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface AttributeValue permits AttributeValue.Single, AttributeValue.Multi {

  /**
   * Creates a single-valued attribute.
   *
   * @param value attribute value; must not be {@code null}
   * @return single value wrapper
   */
  static AttributeValue of(String value) {
    return new Single(value);
  }

  /**
   * Adds another value, promoting a single value to a list when required. Values are never overwritten.
   *
   * @param value value to add; must not be {@code null}
   * @return the resulting attribute value (a {@link Multi} after the call)
   * @throws UnsupportedOperationException if this value was frozen
   */
  AttributeValue append(String value);

  /**
   * Returns all values in insertion order.
   *
   * @return unmodifiable view of the values
   */
  List<String> values();

  /**
   * Returns an immutable copy safe to publish outside the assembler.
   *
   * @return frozen value
   */
  AttributeValue freeze();

  /**
   * Returns the record form: a plain string for one value, a list for genuinely multi-valued attributes.
   *
   * @return {@link String} or {@link List} of strings
   */
  default Object toRecordValue() {
    List<String> values = values();
    return values.size() == 1 ? values.get(0) : values;
  }

  /**
   * Attribute holding exactly one value.
   *
   * @param value stored value
   */
  record Single(String value) implements AttributeValue {
    public Single {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public AttributeValue append(String next) {
      List<String> values = new ArrayList<>(4);
      values.add(value);
      values.add(Objects.requireNonNull(next, "value"));
      return new Multi(values);
    }

    @Override
    public List<String> values() {
      return List.of(value);
    }

    @Override
    public AttributeValue freeze() {
      return this;
    }
  }

  /**
   * Attribute holding an ordered list of values.
   *
   * @param values stored values; mutable while owned by an assembler
   */
  record Multi(List<String> values) implements AttributeValue {
    public Multi {
      Objects.requireNonNull(values, "values");
    }

    @Override
    public AttributeValue append(String next) {
      values.add(Objects.requireNonNull(next, "value"));
      return this;
    }

    @Override
    public List<String> values() {
      return Collections.unmodifiableList(values);
    }

    @Override
    public AttributeValue freeze() {
      return new Multi(List.copyOf(values));
    }
  }
}
