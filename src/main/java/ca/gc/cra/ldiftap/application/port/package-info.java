/**
 * <strong>Purpose:</strong> Ports through which the extract pipeline discovers input, emits entries and records metrics.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters live in {@code infrastructure} and {@code adapter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.application.port;
