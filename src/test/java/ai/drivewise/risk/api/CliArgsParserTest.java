package ai.drivewise.risk.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"sink=none", " batchSize = 50 "});
    assertEquals("none", map.get("sink"));
    assertEquals("50", map.get("batchSize"));
  }

  @Test
  void blankValueClearsSetting() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"tomtomApiKey="});
    assertEquals("", map.get("tomtomApiKey"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\0b"}));
  }

  @Test
  void rejectsDuplicateKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"sink=none", "sink=kafka"}));
  }

  @Test
  void nullInputYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}
