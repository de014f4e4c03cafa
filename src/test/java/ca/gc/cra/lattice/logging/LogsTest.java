package ca.gc.cra.lattice.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortPayloadIsReturnedVerbatim() {
    assertEquals("{\"a\":1}", Logs.truncate("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void longPayloadIsCutWithSuffix() {
    String text = Logs.truncate("abcdefghij".getBytes(StandardCharsets.UTF_8), 4);

    assertEquals("abcd... (truncated, 4 of 10 bytes)", text);
  }

  @Test
  void controlCharactersAndNullAreMadePrintable() {
    assertEquals("a?b", Logs.truncate(new byte[] {'a', 0x07, 'b'}));
    assertEquals("<null>", Logs.truncate(null));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void invalidUtf8IsReplaced() {
    String text = Logs.truncate(new byte[] {(byte) 0xC3, (byte) 0x28});

    assertTrue(text.endsWith("("));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate(new byte[] {1}, 0));
  }
}
