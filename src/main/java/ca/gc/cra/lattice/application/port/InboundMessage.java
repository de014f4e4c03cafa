package ca.gc.cra.lattice.application.port;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw message delivered by a {@link Subscription}.
 *
 * @param subject subject the message was published to
 * @param payload raw payload bytes
 * @param arrival instant the transport delivered the message
 *
 * @since 0.1.0
 */
public record InboundMessage(String subject, byte[] payload, Instant arrival) {

  public InboundMessage {
    subject = Objects.requireNonNull(subject, "subject");
    payload = Objects.requireNonNull(payload, "payload");
    arrival = Objects.requireNonNull(arrival, "arrival");
  }
}
