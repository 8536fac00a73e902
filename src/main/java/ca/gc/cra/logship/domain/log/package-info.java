/**
 * Value types describing log severity and field encoding profiles.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logship.domain.log;
