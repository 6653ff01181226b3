/**
 * <strong>Purpose:</strong> Configuration model, layered loading (defaults, YAML, CLI) and adapter wiring.
 * <p><strong>Concurrency:</strong> Configuration values are immutable once built.</p>
 * <p><strong>Observability:</strong> Validation failures name the offending key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.config;
