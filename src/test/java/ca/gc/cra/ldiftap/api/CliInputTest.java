package ca.gc.cra.ldiftap.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"filePath=a.ldif", "--dry-run", "-v", " ", "output=FILE"});

    assertArrayEquals(new String[] {"filePath=a.ldif", "output=FILE"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertFalse(input.hasFlag("--force"));
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
