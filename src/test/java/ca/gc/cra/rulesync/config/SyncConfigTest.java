package ca.gc.cra.rulesync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.fetch.FetchOptions;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SyncConfigTest {

  @Test
  void parsesEverySetting() {
    Map<String, String> kv = Map.ofEntries(
        Map.entry("cacheDir", "/srv/cache"),
        Map.entry("cacheTtlHours", "6"),
        Map.entry("cacheEvictHours", "72"),
        Map.entry("workDir", "/srv/work/../work"),
        Map.entry("outputDir", "/srv/out"),
        Map.entry("version", "2"),
        Map.entry("concurrency", "8"),
        Map.entry("maxRetries", "0"),
        Map.entry("retryDelayMillis", "250"),
        Map.entry("requestTimeoutSeconds", "10"),
        Map.entry("useCache", "no"),
        Map.entry("supportResume", "off"),
        Map.entry("userAgent", "rulesync/1.0"),
        Map.entry("denylist", " a.com , ,b.org "),
        Map.entry("validateCidr", "yes"),
        Map.entry("progressIntervalMillis", "0"),
        Map.entry("rulesetParallelism", "4"),
        Map.entry("compilerCommand", "  sing-box rule-set compile --output {output} {input} "),
        Map.entry("compiledDir", "/srv/srs"),
        Map.entry("compilerTimeoutSeconds", "60"),
        Map.entry("keepWorkFiles", "true"),
        Map.entry("only", "ai,telegram"),
        Map.entry("dryRun", "1"));

    SyncConfig config = SyncConfig.fromMap(kv);

    assertEquals(Path.of("/srv/cache"), config.cacheDir());
    assertEquals(Duration.ofHours(6), config.cacheTtl());
    assertEquals(72, config.cacheEvictHours());
    assertEquals(Path.of("/srv/work"), config.workDir());
    assertEquals(2, config.version());
    assertEquals(8, config.concurrency());
    assertEquals(new FetchOptions(0, Duration.ofMillis(250), false, false), config.fetchOptions());
    assertEquals(Duration.ofSeconds(10), config.requestTimeout());
    assertEquals("rulesync/1.0", config.userAgent());
    assertEquals(List.of("a.com", "b.org"), config.denylist());
    assertTrue(config.validateCidr());
    assertEquals(4, config.rulesetParallelism());
    assertEquals(Optional.of("sing-box rule-set compile --output {output} {input}"), config.compilerCommand());
    assertEquals(Duration.ofSeconds(60), config.compilerTimeout());
    assertTrue(config.keepWorkFiles());
    assertEquals(Set.of("ai", "telegram"), config.only());
    assertTrue(config.dryRun());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    SyncConfig config = SyncConfig.fromMap(Map.of("concurrency", " ", "compilerCommand", ""));

    assertEquals(5, config.concurrency());
    assertEquals(Optional.empty(), config.compilerCommand());
  }

  @Test
  void emptyDenylistDisablesFiltering() {
    assertTrue(SyncConfig.fromMap(Map.of("denylist", "")).denylist().isEmpty());
    assertEquals(List.of("ruleset.skk.moe"), SyncConfig.fromMap(Map.of()).denylist());
  }

  @Test
  void outOfRangeValuesNameTheKey() {
    IllegalArgumentException concurrency = assertThrows(IllegalArgumentException.class,
        () -> SyncConfig.fromMap(Map.of("concurrency", "65")));
    assertTrue(concurrency.getMessage().contains("concurrency"));

    IllegalArgumentException retries = assertThrows(IllegalArgumentException.class,
        () -> SyncConfig.fromMap(Map.of("maxRetries", "many")));
    assertTrue(retries.getMessage().contains("maxRetries"));

    IllegalArgumentException cidr = assertThrows(IllegalArgumentException.class,
        () -> SyncConfig.fromMap(Map.of("validateCidr", "maybe")));
    assertEquals("validateCidr must be true or false (was 'maybe')", cidr.getMessage());

    assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(Map.of("version", "0")));
    assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(Map.of("userAgent", "bad\tagent")));
  }

  @Test
  void withoutCacheOnlyDisablesCache() {
    SyncConfig config = SyncConfig.defaults();
    SyncConfig uncached = config.withoutCache();

    assertFalse(uncached.useCache());
    assertFalse(uncached.fetchOptions().useCache());
    assertEquals(config.cacheDir(), uncached.cacheDir());
    assertEquals(config.concurrency(), uncached.concurrency());
  }
}
