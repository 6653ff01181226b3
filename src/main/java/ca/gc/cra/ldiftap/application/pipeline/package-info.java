/**
 * <strong>Purpose:</strong> Extraction pipeline: sequential file processing, batching and run reporting.
 * <p><strong>Concurrency:</strong> Single-threaded; one file open at a time.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.application.pipeline;
