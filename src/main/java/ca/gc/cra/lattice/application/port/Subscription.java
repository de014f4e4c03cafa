package ca.gc.cra.lattice.application.port;

import java.time.Duration;
import java.util.Optional;

/**
 * Transient delivery channel returned by {@link TransportPort#subscribeEphemeral(String)}.
 *
 * <p><strong>Thread-safety:</strong> One consumer thread polls; {@link #close()} may be called from any thread
 * and wakes a blocked poller.</p>
 *
 * @since 0.1.0
 */
public interface Subscription extends AutoCloseable {

  /**
   * Returns the pattern this subscription was opened with.
   *
   * @return subject pattern
   */
  String subjectPattern();

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @param timeout maximum wait; zero or negative polls without waiting
   * @return next message, or empty when the wait elapsed or the subscription is closed
   * @throws InterruptedException if the polling thread is interrupted
   */
  Optional<InboundMessage> poll(Duration timeout) throws InterruptedException;

  /**
   * Indicates whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  boolean isClosed();

  /**
   * Releases transport resources. Idempotent.
   */
  @Override
  void close();
}
