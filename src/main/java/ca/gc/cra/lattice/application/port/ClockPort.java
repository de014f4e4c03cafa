package ca.gc.cra.lattice.application.port;

/**
 * <strong>What:</strong> Port supplying timestamps to the collector and event watcher.
 * <p><strong>Why:</strong> Snapshot windows are stamped with wall-clock time while deadlines use a monotonic
 * source; tests inject fixed wall-clock values.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.lattice.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic reading for deadline arithmetic.
   *
   * @return nanoseconds from an arbitrary origin
   */
  default long monotonicNanos() {
    return System.nanoTime();
  }

  /** Default clock using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
