/**
 * <strong>Purpose:</strong> Streaming LDIF recognizer: physical line splitting, line classification, value
 * decoding and lazy entry iteration.
 * <p><strong>Pipeline role:</strong> Infrastructure feeding the extract use case.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.ldiftap.infrastructure.ldif.LdifParser} is shareable; readers
 * are single-owner.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.infrastructure.ldif;
