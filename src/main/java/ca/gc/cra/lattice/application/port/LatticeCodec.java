package ca.gc.cra.lattice.application.port;

import ca.gc.cra.lattice.domain.control.TerminateCommand;
import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.domain.query.QueryRequest;
import ca.gc.cra.lattice.domain.query.ReplyRecord;
import java.time.Instant;

/**
 * <strong>What:</strong> Port encoding requests and decoding replies and events exchanged on the bus.
 * <p><strong>Why:</strong> Separates the wire format from the collector so decode failures can be handled
 * uniformly.</p>
 * <p><strong>Role:</strong> Implemented by {@code JsonLatticeCodec}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or otherwise safe for concurrent use.</p>
 *
 * @implNote Decode methods never throw; every failure is reported as a {@link DecodeResult} failure.
 * @since 0.1.0
 */
public interface LatticeCodec {

  byte[] encodeRequest(QueryRequest request);

  DecodeResult<QueryRequest> decodeRequest(byte[] payload);

  byte[] encodeReply(ReplyRecord reply);

  /**
   * Decodes a reply payload.
   *
   * @param payload raw bytes, possibly {@code null} or corrupt
   * @return decoded reply or the reason it was rejected
   */
  DecodeResult<ReplyRecord> decodeReply(byte[] payload);

  byte[] encodeTerminate(TerminateCommand command);

  DecodeResult<TerminateCommand> decodeTerminate(byte[] payload);

  /**
   * Wraps a bus event in a CloudEvents envelope and encodes it.
   *
   * @param event event to publish
   * @param eventId unique event identifier
   * @param time event timestamp
   * @return envelope bytes
   */
  byte[] encodeEvent(BusEvent event, String eventId, Instant time);

  /**
   * Decodes a CloudEvents envelope and the bus event it carries.
   *
   * @param payload raw bytes, possibly {@code null} or corrupt
   * @return decoded event or the reason it was rejected
   */
  DecodeResult<BusEvent> decodeEvent(byte[] payload);
}
