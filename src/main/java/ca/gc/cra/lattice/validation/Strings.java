package ca.gc.cra.lattice.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers flowing into subjects, topics and configuration.
 * <p><strong>Why:</strong> A host id containing a dot or wildcard would silently address the wrong subject, so
 * identifiers are checked before any request is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Pattern SUBJECT_TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9_:-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name parameter name for diagnostics
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  /**
   * Validates a single subject token such as a host id, correlation id or inbox prefix.
   *
   * <p>Dots, wildcards and whitespace are rejected because they change how the subject is routed.</p>
   *
   * @param name parameter name for diagnostics
   * @param token candidate token
   * @return trimmed token
   */
  public static String requireSubjectToken(String name, String token) {
    String sanitized = requireNonBlank(name, token);
    if (!SUBJECT_TOKEN_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must be a single subject token (letters, digits, '_', ':' or '-'): " + sanitized);
    }
    return sanitized;
  }

  /**
   * Validates a dotted subject prefix made of subject tokens (e.g., {@code wasmbus} or {@code prod.wasmbus}).
   *
   * @param name parameter name for diagnostics
   * @param subject candidate subject
   * @return trimmed subject
   */
  public static String requireSubject(String name, String subject) {
    String sanitized = requireNonBlank(name, subject);
    for (String token : sanitized.split("\\.", -1)) {
      if (token.isEmpty()) {
        throw new IllegalArgumentException(label(name) + " must not contain empty tokens: " + sanitized);
      }
      requireSubjectToken(name, token);
    }
    return sanitized;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
