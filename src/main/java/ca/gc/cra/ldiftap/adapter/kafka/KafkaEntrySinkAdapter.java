package ca.gc.cra.ldiftap.adapter.kafka;

import ca.gc.cra.ldiftap.application.port.EntrySinkPort;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.infrastructure.sink.EntryJsonWriter;
import ca.gc.cra.ldiftap.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka sink that publishes one record per LDIF entry, keyed by DN with the JSON record as value.
 * <p>Delegates publishing to an underlying {@link Producer}; records are enqueued asynchronously and
 * {@link #flush()} blocks until they are acknowledged.</p>
 *
 * @implNote Send failures reported through the producer callback are logged; the first one is rethrown from the
 * next {@link #flush()}.
 * @since 0.1.0
 */
public final class KafkaEntrySinkAdapter implements EntrySinkPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaEntrySinkAdapter.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final EntryJsonWriter json = new EntryJsonWriter();
  private volatile Exception sendFailure;

  /**
   * Creates a sink backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @throws IllegalArgumentException if either argument is blank or the topic name is invalid
   */
  public KafkaEntrySinkAdapter(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaEntrySinkAdapter(Producer<String, String> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
  }

  @Override
  public void write(List<LdifEntry> batch) throws IOException {
    Objects.requireNonNull(batch, "batch");
    for (LdifEntry entry : batch) {
      ProducerRecord<String, String> record = new ProducerRecord<>(topic, entry.dn(), json.toJson(entry));
      producer.send(record, (metadata, ex) -> {
        if (ex != null) {
          log.error("Kafka publish failure for topic {} (dn {})", topic, entry.dn(), ex);
          if (sendFailure == null) {
            sendFailure = ex;
          }
        }
      });
    }
  }

  @Override
  public void flush() throws Exception {
    producer.flush();
    Exception failure = sendFailure;
    if (failure != null) {
      sendFailure = null;
      throw failure;
    }
  }

  /**
   * Flushes pending records and closes the producer.
   *
   * @implNote Waits up to five seconds for in-flight send operations to complete.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
