/**
 * Argument validation helpers shared by configuration, CLI and the query façade.
 */
package ca.gc.cra.lattice.validation;
