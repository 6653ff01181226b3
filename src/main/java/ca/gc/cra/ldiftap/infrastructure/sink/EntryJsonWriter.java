package ca.gc.cra.ldiftap.infrastructure.sink;

import ca.gc.cra.ldiftap.domain.ldif.AttributeValue;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes {@link LdifEntry} values to single-line JSON objects using the Jackson streaming generator.
 *
 * <p>Field names and shapes follow {@link LdifEntry#toRecord()}: single-valued attributes are strings,
 * repeated attributes are arrays, and an absent change type is {@code null}.</p>
 *
 * @since 0.1.0
 */
public final class EntryJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Serializes one entry.
   *
   * @param entry entry to serialize; must not be {@code null}
   * @return compact JSON text without a trailing newline
   * @throws IOException if the generator fails
   */
  public String toJson(LdifEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField(LdifEntry.KEY_DN, entry.dn());
      writeAttributes(gen, entry.attributes());
      gen.writeArrayFieldStart(LdifEntry.KEY_OBJECT_CLASS);
      for (String objectClass : entry.objectClass()) {
        gen.writeString(objectClass);
      }
      gen.writeEndArray();
      if (entry.changeType().isPresent()) {
        gen.writeStringField(LdifEntry.KEY_CHANGE_TYPE, entry.changeType().get());
      } else {
        gen.writeNullField(LdifEntry.KEY_CHANGE_TYPE);
      }
      gen.writeStringField(LdifEntry.KEY_SOURCE_FILE, entry.sourceFile());
      gen.writeNumberField(LdifEntry.KEY_LINE_NUMBER, entry.lineNumber());
      gen.writeNumberField(LdifEntry.KEY_ENTRY_SIZE, entry.entrySize());
      gen.writeEndObject();
    }
    return out.toString();
  }

  private static void writeAttributes(JsonGenerator gen, Map<String, AttributeValue> attributes)
      throws IOException {
    gen.writeObjectFieldStart(LdifEntry.KEY_ATTRIBUTES);
    for (Map.Entry<String, AttributeValue> attribute : attributes.entrySet()) {
      AttributeValue value = attribute.getValue();
      if (value instanceof AttributeValue.Single single) {
        gen.writeStringField(attribute.getKey(), single.value());
        continue;
      }
      List<String> values = value.values();
      gen.writeArrayFieldStart(attribute.getKey());
      for (String item : values) {
        gen.writeString(item);
      }
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }
}
