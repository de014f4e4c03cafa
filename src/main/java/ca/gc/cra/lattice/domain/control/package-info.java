/**
 * Control-plane commands: launch auctions, launch and terminate.
 */
package ca.gc.cra.lattice.domain.control;
