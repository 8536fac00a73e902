/**
 * Forwarder configuration: immutable settings plus the environment, YAML, and merge glue that produce them.
 */
package ca.gc.cra.logship.config;
