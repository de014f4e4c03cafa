/**
 * Ports consumed by the lattice query and event use cases.
 * <p><strong>Role:</strong> Seams between the application layer and the Kafka, in-memory, JSON and
 * OpenTelemetry adapters.</p>
 */
package ca.gc.cra.lattice.application.port;
