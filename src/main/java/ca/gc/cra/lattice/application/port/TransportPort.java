package ca.gc.cra.lattice.application.port;

/**
 * <strong>What:</strong> Port abstracting the publish/subscribe bus shared by every lattice host.
 * <p><strong>Why:</strong> Keeps the scatter-gather protocol independent of the broker (Kafka in production,
 * an in-memory bus in tests).</p>
 * <p><strong>Role:</strong> Leaf port implemented by {@code KafkaTransportAdapter} and {@code InMemoryTransportAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Publish raw payloads to a subject without waiting for replies.</li>
 *   <li>Open transient subscriptions that deliver raw inbound messages until closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent publishers and subscribers; many
 * queries share one transport.</p>
 * <p><strong>Observability:</strong> Adapters report publish failures via {@code transport.publish.failed}.</p>
 *
 * @implNote No retries are performed at this layer.
 * @since 0.1.0
 */
public interface TransportPort extends AutoCloseable {

  /**
   * Publishes a payload to a subject. Returns once the transport has accepted the message.
   *
   * @param subject dotted subject (e.g., {@code wasmbus.inventory.hosts}); must not be {@code null}
   * @param payload raw payload bytes; must not be {@code null}
   * @throws TransportException if the connection is down or the payload exceeds transport limits
   */
  void publish(String subject, byte[] payload);

  /**
   * Opens a transient subscription delivering every message whose subject matches the pattern.
   *
   * <p>Messages published before this call returns are not guaranteed to be delivered; callers
   * must subscribe before publishing a request.</p>
   *
   * @param subjectPattern exact subject or wildcard pattern ({@code *} one token, {@code >} the rest)
   * @return open subscription owned exclusively by the caller
   * @throws TransportException if the subscription cannot be created
   */
  Subscription subscribeEphemeral(String subjectPattern);

  /**
   * Releases the connection. Open subscriptions are closed.
   */
  @Override
  void close();
}
