package ca.gc.cra.rulesync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("concurrency", "5", "outputDir", "output/json");
    Map<String, String> yaml = Map.of("concurrency", "8", "maxRetries", "2");
    Map<String, String> cli = Map.of("concurrency", "12", "outputDir", "/tmp/out");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "sync", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("12", merged.get("concurrency"));
    assertEquals("/tmp/out", merged.get("outputDir"));
    assertEquals("2", merged.get("maxRetries"));
    assertEquals(List.of("CLI overrides YAML for key: concurrency"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "cache", Optional.of(Map.of("cacheDir", "/srv/cache")), Map.of(), Map.of("cacheDir", "temp/cache"),
        warnings::add);

    assertEquals("/srv/cache", merged.get("cacheDir"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void compilerCommandRequiresInputPlaceholder() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "sync", Optional.empty(), Map.of("compilerCommand", "sing-box compile"), Map.of(), msg -> {}));
  }

  @Test
  void warnsWhenPruningIsShorterThanTtl() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "sync",
        Optional.empty(),
        Map.of("cacheTtlHours", "24", "cacheEvictHours", "12"),
        Map.of(),
        warnings::add);

    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).startsWith("cacheEvictHours (12) is shorter than cacheTtlHours (24)"));
  }

  @Test
  void defaultsAloneAreValid() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "sync", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("sync"), msg -> {});

    assertEquals(DefaultsForMode.asFlatMap("sync"), merged);
  }
}
