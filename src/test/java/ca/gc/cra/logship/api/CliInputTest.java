package ca.gc.cra.logship.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromArguments() {
    CliInput input = CliInput.parse(new String[] {"tag=demo", "--DRY-RUN", " ", null, "-v", "workers=2"});

    assertEquals(List.of("tag=demo", "workers=2"), input.arguments());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).help());
  }

  @Test
  void dashedKeyValueStaysAnArgument() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertEquals(List.of("-x=1"), input.arguments());
  }

  @Test
  void nullArgsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.arguments().isEmpty());
    assertFalse(input.hasFlag(null));
  }
}
