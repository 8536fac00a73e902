/**
 * <strong>Purpose:</strong> Input validation helpers for forwarder configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException}; the config layer
 * converts them to {@link ca.gc.cra.logship.domain.error.ConfigException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logship.validation;
