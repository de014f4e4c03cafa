/**
 * Clock adapters.
 */
package ca.gc.cra.lattice.infrastructure.time;
