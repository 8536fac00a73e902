/**
 * Thread and executor construction helpers.
 */
package ca.gc.cra.logship.infrastructure.exec;
