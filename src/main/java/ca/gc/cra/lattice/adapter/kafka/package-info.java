/**
 * Kafka transport for the lattice client.
 * <p><strong>Role:</strong> Adapter layer implementing {@link ca.gc.cra.lattice.application.port.TransportPort}.</p>
 * <p><strong>Concurrency:</strong> One producer shared by all queries; one consumer per ephemeral subscription.</p>
 */
package ca.gc.cra.lattice.adapter.kafka;
