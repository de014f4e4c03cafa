/**
 * Scatter-gather queries: the {@link ca.gc.cra.lattice.application.query.LatticeClient} façade, the per-query
 * {@link ca.gc.cra.lattice.application.query.ScatterGatherCollector} and the pure
 * {@link ca.gc.cra.lattice.application.query.SnapshotAggregator}.
 * <p><strong>Concurrency:</strong> One collector per query; queries share the transport and are isolated by
 * correlation id and reply subject.</p>
 */
package ca.gc.cra.lattice.application.query;
