package ca.gc.cra.lattice.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void bootstrapListIsNormalized() {
    assertEquals("broker1:9092,10.0.0.5:9093",
        Net.validateBootstrapServers("broker1:9092, 10.0.0.5:9093"));
  }

  @Test
  void ipv6LiteralsMustBeBracketed() {
    assertEquals("[::1]:9092", Net.validateHostPort("[::1]:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("::1:9092"));
  }

  @Test
  void invalidEndpointsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("broker"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("broker:0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers("a:1,,b:2"));
  }

  @Test
  void numbersParseWithinRange() {
    assertEquals(600L, Numbers.parseRange("timeoutMillis", "600", 1, 600_000));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("timeoutMillis", "ten", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("timeoutMillis", 0, 1, 10));
  }
}
