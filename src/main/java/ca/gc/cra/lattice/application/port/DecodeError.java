package ca.gc.cra.lattice.application.port;

import java.util.Objects;

/**
 * Reason a raw payload could not be turned into a typed record.
 *
 * @param kind failure category
 * @param detail human-readable detail for logs
 *
 * @since 0.1.0
 */
public record DecodeError(Kind kind, String detail) {

  /** Failure categories. */
  public enum Kind {
    /** The payload is not well-formed JSON (or not JSON at all). */
    MALFORMED_ENCODING,
    /** Well-formed, but required members are missing or carry the wrong type. */
    SCHEMA_MISMATCH,
    /** The payload carries no correlation identifier. */
    CORRELATION_MISSING
  }

  public DecodeError {
    kind = Objects.requireNonNull(kind, "kind");
    detail = detail == null ? "" : detail;
  }

  @Override
  public String toString() {
    return kind + ": " + detail;
  }
}
