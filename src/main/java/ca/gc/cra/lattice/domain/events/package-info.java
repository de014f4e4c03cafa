/**
 * Lattice lifecycle events and their CloudEvents envelope.
 */
package ca.gc.cra.lattice.domain.events;
