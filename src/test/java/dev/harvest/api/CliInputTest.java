package dev.harvest.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"--DRY-RUN", "workers=2", "-v", "--force-all"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--force-all"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"workers=2"}, input.keyValueArgs());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
