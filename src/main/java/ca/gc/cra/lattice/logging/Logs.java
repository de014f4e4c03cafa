package ca.gc.cra.lattice.logging;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps wire payloads in log lines short and printable.
 * <p><strong>Why:</strong> Replies can carry whole inventories and binding configuration; debug logs should show
 * enough to diagnose a bad payload without dumping it.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default byte budget for payload excerpts. */
  public static final int DEFAULT_MAX_BYTES = 256;
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders a raw payload as UTF-8 text cut to {@link #DEFAULT_MAX_BYTES}.
   *
   * @param payload raw bytes; {@code null} renders as {@code <null>}
   * @return printable excerpt
   */
  public static String truncate(byte[] payload) {
    return truncate(payload, DEFAULT_MAX_BYTES);
  }

  /**
   * Renders a raw payload as UTF-8 text cut to {@code maxBytes}, noting the original size when cut.
   *
   * @param payload raw bytes; {@code null} renders as {@code <null>}
   * @param maxBytes byte budget; must be positive
   * @return printable excerpt
   */
  public static String truncate(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int length = Math.min(payload.length, maxBytes);
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE)
          .decode(ByteBuffer.wrap(payload, 0, length))
          .toString();
    } catch (CharacterCodingException ex) {
      text = new String(payload, 0, length, StandardCharsets.ISO_8859_1);
    }
    text = printable(text);
    if (payload.length > maxBytes) {
      return text + "... (truncated, " + maxBytes + " of " + payload.length + " bytes)";
    }
    return text;
  }

  private static String printable(String text) {
    StringBuilder out = null;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isISOControl(c)) {
        if (out == null) {
          out = new StringBuilder(text.length()).append(text, 0, i);
        }
        out.append('?');
      } else if (out != null) {
        out.append(c);
      }
    }
    return out == null ? text : out.toString();
  }
}
