package ca.gc.cra.rulesync.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"concurrency=8", " outputDir = out/json "});
    assertEquals("8", map.get("concurrency"));
    assertEquals("out/json", map.get("outputDir"));
  }

  @Test
  void splitsOnFirstEqualsOnly() {
    Map<String, String> map =
        CliArgsParser.toMap(new String[] {"compilerCommand=tool --opt=1 {input}"});
    assertEquals("tool --opt=1 {input}", map.get("compilerCommand"));
  }

  @Test
  void keepsEmptyValueToClearSetting() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"compilerCommand="});
    assertEquals("", map.get("compilerCommand"));
  }

  @Test
  void rejectsBareTokensAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0001b"}));
  }

  @Test
  void rejectsRepeatedName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"only=ai", "concurrency=2", "only=telegram"}));
    assertEquals("argument only given more than once", ex.getMessage());
  }

  @Test
  void nullArgumentsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}
