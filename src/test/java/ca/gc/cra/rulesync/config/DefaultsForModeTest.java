package ca.gc.cra.rulesync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void syncDefaultsMatchSyncConfigDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("sync");

    assertEquals(SyncConfig.defaults(), SyncConfig.fromMap(defaults));
    assertEquals("temp/cache", defaults.get("cacheDir"));
    assertEquals("output/json", defaults.get("outputDir"));
    assertEquals("ruleset.skk.moe", defaults.get("denylist"));
    assertEquals("none", defaults.get("metricsExporter"));
  }

  @Test
  void cacheDefaultsCarryCommonKeysOnly() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Cache ");

    assertEquals("24", defaults.get("cacheTtlHours"));
    assertEquals("", defaults.get("olderThanHours"));
    assertFalse(defaults.containsKey("concurrency"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
