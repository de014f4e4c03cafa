package ca.gc.cra.lattice.application.port;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one payload: either a value or a {@link DecodeError}, never both.
 *
 * @param <T> decoded type
 * @since 0.1.0
 */
public final class DecodeResult<T> {

  private final T value;
  private final DecodeError error;

  private DecodeResult(T value, DecodeError error) {
    this.value = value;
    this.error = error;
  }

  /**
   * Wraps a decoded value.
   *
   * @param value decoded value; must not be {@code null}
   * @param <T> decoded type
   * @return successful result
   */
  public static <T> DecodeResult<T> success(T value) {
    return new DecodeResult<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Wraps a decode failure.
   *
   * @param kind failure category
   * @param detail human-readable detail
   * @param <T> decoded type
   * @return failed result
   */
  public static <T> DecodeResult<T> failure(DecodeError.Kind kind, String detail) {
    return new DecodeResult<>(null, new DecodeError(kind, detail));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  public Optional<DecodeError> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the value of a successful result.
   *
   * @return decoded value
   * @throws IllegalStateException if the result is a failure
   */
  public T orElseThrow() {
    if (error != null) {
      throw new IllegalStateException("decode failed: " + error);
    }
    return value;
  }

  @Override
  public String toString() {
    return isSuccess() ? "DecodeResult[" + value + "]" : "DecodeResult[" + error + "]";
  }
}
