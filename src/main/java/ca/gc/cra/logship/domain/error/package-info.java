/**
 * <strong>Purpose:</strong> Checked exception taxonomy shared by the forwarder's sink, facade, and lifecycle owner.
 * <p><strong>Pipeline role:</strong> Domain layer; adapters translate library failures into these types.
 * <p><strong>Concurrency:</strong> Exceptions are immutable once thrown.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logship.domain.error;
