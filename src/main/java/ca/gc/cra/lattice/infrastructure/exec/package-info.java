/**
 * Thread and executor factories.
 * <p><strong>Concurrency:</strong> All threads created here are daemons named after their role.</p>
 */
package ca.gc.cra.lattice.infrastructure.exec;
