package ca.gc.cra.lattice.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesPositionalsOptionsAndFlags() {
    CliInput input = CliInput.parse(new String[] {"list", "hosts", "timeout=200", "--DRY-RUN", "-j"});

    assertEquals(List.of("list", "hosts"), input.positionals());
    assertArrayEquals(new String[] {"timeout=200"}, input.keyValueArgs());
    assertTrue(input.dryRun());
    assertTrue(input.json());
    assertTrue(input.hasFlag(" --Dry-Run "));
    assertFalse(input.help());
  }

  @Test
  void helpAndVerboseAliasesAreNormalized() {
    CliInput input = CliInput.parse(new String[] {"help", "--debug"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.positionals().isEmpty());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"-v"}).verbose());
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    CliInput input = CliInput.parse(new String[] {null, " ", "watch"});

    assertEquals(List.of("watch"), input.positionals());
    assertTrue(CliInput.parse(null).flags().isEmpty());
  }

  @Test
  void remainderDropsConsumedWordsAndKeepsOptions() {
    CliInput input = CliInput.parse(new String[] {"list", "--json", "actors", "host=h1"});

    assertArrayEquals(new String[] {"actors", "host=h1", "--json"}, input.remainderAfter(1));
    assertArrayEquals(new String[] {"host=h1", "--json"}, input.remainderAfter(5));
  }
}
