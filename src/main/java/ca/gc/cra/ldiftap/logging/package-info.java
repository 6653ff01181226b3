/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound how much LDIF content reaches logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Line previews are truncated so large attribute values are not dumped.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.logging;
