/**
 * Logging helpers: runtime level control and payload excerpts.
 */
package ca.gc.cra.lattice.logging;
