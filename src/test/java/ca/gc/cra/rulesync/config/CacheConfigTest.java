package ca.gc.cra.rulesync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CacheConfigTest {

  @Test
  void defaultsApplyWhenKeysAreMissing() {
    CacheConfig config = CacheConfig.fromMap(Map.of());

    assertEquals(Path.of("temp/cache"), config.cacheDir());
    assertEquals(Duration.ofHours(24), config.cacheTtl());
    assertEquals(Optional.empty(), config.olderThanHours());
  }

  @Test
  void parsesThreshold() {
    CacheConfig config = CacheConfig.fromMap(
        Map.of("cacheDir", "/srv/cache/", "cacheTtlHours", "12", "olderThanHours", "72"));

    assertEquals(Path.of("/srv/cache"), config.cacheDir());
    assertEquals(Duration.ofHours(12), config.cacheTtl());
    assertEquals(Optional.of(72), config.olderThanHours());
  }

  @Test
  void rejectsNegativeThreshold() {
    assertThrows(IllegalArgumentException.class, () -> CacheConfig.fromMap(Map.of("olderThanHours", "-1")));
    assertThrows(IllegalArgumentException.class, () -> CacheConfig.fromMap(Map.of("cacheTtlHours", "0")));
  }
}
