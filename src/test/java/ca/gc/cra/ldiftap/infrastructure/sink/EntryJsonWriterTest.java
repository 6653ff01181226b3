package ca.gc.cra.ldiftap.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ldiftap.domain.ldif.EntryAssembler;
import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class EntryJsonWriterTest {

  @Test
  void writesSingleValuesAsStringsAndRepeatsAsArrays() throws IOException {
    EntryAssembler assembler = new EntryAssembler(EntryFilterPolicy.defaults(), "people.ldif", 4);
    assembler.dn("cn=\"Quoted\",dc=example");
    assembler.add("cn", "Quoted");
    assembler.add("mail", "a@example.com");
    assembler.add("mail", "b@example.com");
    assembler.add("objectClass", "person");
    assembler.addBytes(99);
    LdifEntry entry = assembler.build().orElseThrow();

    String json = new EntryJsonWriter().toJson(entry);

    assertEquals("{\"dn\":\"cn=\\\"Quoted\\\",dc=example\","
        + "\"attributes\":{\"cn\":\"Quoted\",\"mail\":[\"a@example.com\",\"b@example.com\"],"
        + "\"objectclass\":\"person\"},"
        + "\"object_class\":[\"person\"],"
        + "\"change_type\":null,"
        + "\"source_file\":\"people.ldif\","
        + "\"line_number\":4,"
        + "\"entry_size\":99}", json);
  }

  @Test
  void writesChangeTypeWhenPresent() throws IOException {
    EntryAssembler assembler = new EntryAssembler(EntryFilterPolicy.defaults(), "c.ldif", 1);
    assembler.dn("cn=x");
    assembler.add("changetype", "delete");

    String json = new EntryJsonWriter().toJson(assembler.build().orElseThrow());

    assertTrue(json.contains("\"change_type\":\"delete\""));
  }
}
