package ca.gc.cra.ldiftap.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ldiftap.domain.ldif.EntryAssembler;
import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import java.util.List;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaEntrySinkAdapterTest {

  @Test
  void publishesEntryKeyedByDn() throws Exception {
    MockProducer<String, String> producer =
        new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaEntrySinkAdapter adapter = new KafkaEntrySinkAdapter(producer, "ldif.entries");

    adapter.write(List.of(entry("cn=a,dc=example"), entry("cn=b,dc=example")));
    adapter.flush();

    assertEquals(2, producer.history().size());
    var sent = producer.history().get(0);
    assertEquals("ldif.entries", sent.topic());
    assertEquals("cn=a,dc=example", sent.key());
    assertTrue(sent.value().contains("\"dn\":\"cn=a,dc=example\""));
    assertTrue(sent.value().contains("\"source_file\":\"k.ldif\""));
  }

  @Test
  void flushSurfacesAsynchronousSendFailure() {
    MockProducer<String, String> producer =
        new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    KafkaEntrySinkAdapter adapter = new KafkaEntrySinkAdapter(producer, "ldif.entries");
    RuntimeException failure = new RuntimeException("broker down");

    assertDoesNotThrow(() -> adapter.write(List.of(entry("cn=a"))));
    producer.errorNext(failure);

    Exception thrown = assertThrows(Exception.class, adapter::flush);
    assertSame(failure, thrown);
  }

  @Test
  void rejectsInvalidTopic() {
    MockProducer<String, String> producer =
        new MockProducer<>(true, new StringSerializer(), new StringSerializer());

    assertThrows(IllegalArgumentException.class, () -> new KafkaEntrySinkAdapter(producer, "bad topic"));
  }

  @Test
  void closeFlushesAndClosesProducer() throws Exception {
    MockProducer<String, String> producer =
        new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaEntrySinkAdapter adapter = new KafkaEntrySinkAdapter(producer, "ldif.entries");
    adapter.write(List.of(entry("cn=a")));

    adapter.close();

    assertTrue(producer.closed());
    assertEquals(1, producer.history().size());
  }

  private static LdifEntry entry(String dn) {
    EntryAssembler assembler = new EntryAssembler(EntryFilterPolicy.defaults(), "k.ldif", 1);
    assembler.dn(dn);
    return assembler.build().orElseThrow();
  }
}
