/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, resolve configuration, and run the worker demo.</p>
 * <p><strong>Concurrency:</strong> Setup is single-threaded; the worker command runs its own pool.</p>
 */
package ca.gc.cra.logship.api;
