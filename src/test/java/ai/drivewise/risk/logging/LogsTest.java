package ai.drivewise.risk.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void redactUrlMasksApiKeys() {
    String url = "https://api.tomtom.com/traffic/services/4/flowSegmentData/absolute/10/json"
        + "?point=43.6,-79.3&key=secret123&unit=KMPH";
    String redacted = Logs.redactUrl(url);
    assertTrue(redacted.contains("key=[REDACTED]"), redacted);
    assertTrue(redacted.contains("&unit=KMPH"), redacted);
    assertFalse(redacted.contains("secret123"), redacted);
  }

  @Test
  void redactUrlLeavesPlainUrlsAlone() {
    String url = "https://api.nhtsa.gov/SafetyRatings/modelyear/2020/make/honda/model/civic";
    assertEquals(url, Logs.redactUrl(url));
    assertEquals("<null>", Logs.redactUrl(null));
  }

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateDoesNotSplitMultiByteCharacters() {
    String value = "ééé";
    String truncated = Logs.truncate(value, 3);
    assertEquals("é... (6 bytes)", truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abcdef", 0));
  }

  @Test
  void redactHidesSecrets() {
    assertEquals("[REDACTED]", Logs.redact("abc"));
    assertEquals("<unset>", Logs.redact(" "));
    assertEquals("<unset>", Logs.redact(null));
  }
}
