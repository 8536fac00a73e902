/**
 * Lifecycle owner composing transport, sink, and logger into one closeable handle.
 */
package ca.gc.cra.logship.application.forwarder;
