/**
 * {@code latticectl} command-line entry points: {@code list} and {@code watch}.
 * <p>Arguments use {@code key=value} options plus flags; configuration resolves CLI &gt; YAML &gt; defaults.</p>
 */
package ca.gc.cra.lattice.api;
