package ai.drivewise.risk.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesCommandFlagsAndKeyValues() {
    CliInput input = CliInput.parse(new String[] {"Run", "--dry-run", "-v", "sink=none", "extra"});

    assertEquals("run", input.command().orElseThrow());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertArrayEquals(new String[] {"sink=none"}, input.keyValueArgs());
    assertEquals(1, input.positionals().size());
  }

  @Test
  void negativeCoordinatesStayKeyValues() {
    CliInput input = CliInput.parse(new String[] {"lon=-122.4"});

    assertTrue(input.command().isEmpty());
    assertArrayEquals(new String[] {"lon=-122.4"}, input.keyValueArgs());
  }

  @Test
  void emptyArgsHaveNoCommand() {
    CliInput input = CliInput.parse(new String[0]);
    assertTrue(input.command().isEmpty());
    assertFalse(input.hasFlag(" "));
  }
}
