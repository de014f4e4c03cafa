/**
 * In-process transport used by tests and local demos.
 */
package ca.gc.cra.lattice.adapter.memory;
