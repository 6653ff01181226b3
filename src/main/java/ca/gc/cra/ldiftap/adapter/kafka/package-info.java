/**
 * Kafka adapter publishing extracted LDIF entries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.adapter.kafka;
