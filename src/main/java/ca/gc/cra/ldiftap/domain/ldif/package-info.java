/**
 * <strong>Purpose:</strong> LDIF directory entry model and the filtering rules applied while entries are assembled.
 * <p><strong>Pipeline role:</strong> Domain layer shared by the parser, the extract use case and sink adapters.</p>
 * <p><strong>Concurrency:</strong> Finalized values are immutable; assemblers are single-owner.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.domain.ldif;
