package ca.gc.cra.lattice.infrastructure.time;

import ca.gc.cra.lattice.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()} and {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long monotonicNanos() {
    return System.nanoTime();
  }
}
