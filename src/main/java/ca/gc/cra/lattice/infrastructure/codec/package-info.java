/**
 * JSON wire format for lattice requests, replies, commands and CloudEvents envelopes.
 * <p><strong>Concurrency:</strong> Codecs are stateless and shared across queries.</p>
 */
package ca.gc.cra.lattice.infrastructure.codec;
