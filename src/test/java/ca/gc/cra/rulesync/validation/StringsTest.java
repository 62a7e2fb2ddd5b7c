package ca.gc.cra.rulesync.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("field", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
  }

  @Test
  void rulesetNamesAreFileStems() {
    assertEquals("ai-v2.cn_list", Strings.requireRulesetName("name", " ai-v2.cn_list "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireRulesetName("name", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireRulesetName("name", ".."));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireRulesetName("name", "spaced name"));
  }

  @Test
  void printableAsciiEnforcesLengthAndCharset() {
    assertEquals("rulesync/1.0", Strings.requirePrintableAscii("userAgent", "rulesync/1.0", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("userAgent", "abc", 2));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("userAgent", "café", 32));
  }
}
