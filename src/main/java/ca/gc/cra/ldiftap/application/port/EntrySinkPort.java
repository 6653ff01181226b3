package ca.gc.cra.ldiftap.application.port;

import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import java.util.List;

/**
 * <strong>What:</strong> Output port receiving finalized LDIF entries in batches.
 * <p><strong>Role:</strong> Implemented by the NDJSON and Kafka sink adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write each batch in the order given.</li>
 *   <li>Flush buffered output when requested.</li>
 *   <li>Release resources on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the single extraction thread.</p>
 *
 * @since 0.1.0
 */
public interface EntrySinkPort extends AutoCloseable {
  /**
   * Writes a batch of entries.
   *
   * @param batch entries in file order; must not be {@code null}
   * @throws Exception if the underlying store rejects the write
   */
  void write(List<LdifEntry> batch) throws Exception;

  /**
   * Flushes buffered entries.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Closes the sink.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
