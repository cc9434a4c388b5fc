package ai.drivewise.risk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("Toronto", Strings.requireNonBlank("city", "  Toronto "));
  }

  @Test
  void requireNonBlankRejectsBlankNullAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("city", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("city", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("city", "Tor\nonto"));
  }

  @Test
  void sanitizeTopicAcceptsKafkaCharacters() {
    assertEquals("drivewise.prod_v1-a", Strings.sanitizeTopic("kafkaTopicPrefix", " drivewise.prod_v1-a "));
  }

  @Test
  void sanitizeTopicRejectsInvalidCharactersAndLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopicPrefix", "bad topic"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopicPrefix", "a/b"));
    assertThrows(IllegalArgumentException.class,
        () -> Strings.sanitizeTopic("kafkaTopicPrefix", "t".repeat(250)));
  }

  @Test
  void requireTokenAcceptsPrintableAscii() {
    assertEquals("abc123-XYZ", Strings.requireToken("tomtomApiKey", "abc123-XYZ", 64));
  }

  @Test
  void requireTokenRejectsSpacesNonAsciiAndLongValues() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("tomtomApiKey", "abc 123", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("tomtomApiKey", "clé", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("tomtomApiKey", "abcdef", 5));
  }
}
