/**
 * <strong>Purpose:</strong> Command-line entry points ({@code extract}, {@code discover}) and their argument handling.
 * <p><strong>Observability:</strong> Errors are logged via SLF4J; user-facing output goes through
 * {@link ca.gc.cra.ldiftap.api.CliPrinter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.api;
