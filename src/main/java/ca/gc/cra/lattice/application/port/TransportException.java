package ca.gc.cra.lattice.application.port;

/**
 * Signals a connection, publish or subscribe failure on the lattice transport.
 *
 * @since 0.1.0
 */
public class TransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
