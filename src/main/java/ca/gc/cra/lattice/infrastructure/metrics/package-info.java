/**
 * OpenTelemetry-backed {@link ca.gc.cra.lattice.application.port.MetricsPort} adapters.
 * <p><strong>Metrics:</strong> Instruments are created lazily under the {@code ca.gc.cra.lattice} scope.</p>
 */
package ca.gc.cra.lattice.infrastructure.metrics;
