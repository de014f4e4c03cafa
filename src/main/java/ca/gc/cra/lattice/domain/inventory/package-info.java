/**
 * Inventory values reported by lattice hosts: per-host snapshots, workloads and link bindings.
 * <p><strong>Role:</strong> Domain layer; no I/O and no framework dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable records safe to share between query threads.</p>
 */
package ca.gc.cra.lattice.domain.inventory;
