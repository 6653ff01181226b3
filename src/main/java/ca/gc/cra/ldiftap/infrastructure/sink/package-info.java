/**
 * <strong>Purpose:</strong> Local sinks for extracted entries and the JSON record encoding shared with the Kafka
 * adapter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.infrastructure.sink;
