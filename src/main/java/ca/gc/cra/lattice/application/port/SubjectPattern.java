package ca.gc.cra.lattice.application.port;

import java.util.Objects;

/**
 * Dotted subject pattern with NATS-style wildcards: {@code *} matches exactly one token and a
 * trailing {@code >} matches one or more remaining tokens.
 *
 * @since 0.1.0
 */
public final class SubjectPattern {
  private final String pattern;
  private final String[] tokens;

  private SubjectPattern(String pattern) {
    this.pattern = pattern;
    this.tokens = pattern.split("\\.", -1);
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i];
      if (token.isEmpty()) {
        throw new IllegalArgumentException("empty token in subject pattern: " + pattern);
      }
      if (">".equals(token) && i != tokens.length - 1) {
        throw new IllegalArgumentException("'>' must be the last token: " + pattern);
      }
    }
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern dotted pattern, e.g. {@code wasmbus.inventory.*}
   * @return compiled pattern
   * @throws IllegalArgumentException if the pattern is blank or has empty tokens
   */
  public static SubjectPattern compile(String pattern) {
    String trimmed = Objects.requireNonNull(pattern, "pattern").trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("subject pattern must not be blank");
    }
    return new SubjectPattern(trimmed);
  }

  /**
   * Tests a concrete subject against the pattern.
   *
   * @param subject concrete subject; {@code null} never matches
   * @return {@code true} on match
   */
  public boolean matches(String subject) {
    if (subject == null) {
      return false;
    }
    String[] parts = subject.split("\\.", -1);
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i];
      if (">".equals(token)) {
        return parts.length > i;
      }
      if (i >= parts.length) {
        return false;
      }
      if (!"*".equals(token) && !token.equals(parts[i])) {
        return false;
      }
    }
    return parts.length == tokens.length;
  }

  /**
   * Indicates whether the pattern contains wildcards.
   *
   * @return {@code false} for a literal subject
   */
  public boolean isWildcard() {
    for (String token : tokens) {
      if ("*".equals(token) || ">".equals(token)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return pattern;
  }
}
