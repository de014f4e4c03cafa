/**
 * Scatter-gather request, reply and snapshot values.
 * <p><strong>Role:</strong> Domain layer shared by the collector, aggregator and query façade.</p>
 * <p><strong>Concurrency:</strong> Immutable records; a snapshot may be handed to any thread.</p>
 */
package ca.gc.cra.lattice.domain.query;
