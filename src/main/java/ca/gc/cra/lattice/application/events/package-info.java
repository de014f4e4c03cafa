/**
 * Lattice event watch: decodes CloudEvents published by hosts and hands them to listeners.
 */
package ca.gc.cra.lattice.application.events;
