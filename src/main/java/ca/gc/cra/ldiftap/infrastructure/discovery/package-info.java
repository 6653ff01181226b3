/**
 * Filesystem discovery of LDIF input files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.infrastructure.discovery;
