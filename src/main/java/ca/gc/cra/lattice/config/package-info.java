/**
 * Configuration: defaults per CLI mode, YAML loading, precedence merging and the composition root.
 * <p>Precedence is CLI &gt; YAML &gt; environment-seeded defaults.</p>
 */
package ca.gc.cra.lattice.config;
