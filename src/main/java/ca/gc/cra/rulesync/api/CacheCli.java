package ca.gc.cra.rulesync.api;

import ca.gc.cra.rulesync.application.port.CachePort;
import ca.gc.cra.rulesync.config.CacheConfig;
import ca.gc.cra.rulesync.config.ConfigMerger;
import ca.gc.cra.rulesync.config.DefaultsForMode;
import ca.gc.cra.rulesync.config.YamlConfigLoader;
import ca.gc.cra.rulesync.domain.fetch.CacheInfo;
import ca.gc.cra.rulesync.infrastructure.cache.FileSystemCacheAdapter;
import ca.gc.cra.rulesync.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.rulesync.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for inspecting and clearing the download cache.
 *
 * @since 0.1.0
 */
public final class CacheCli {
  private static final Logger log = LoggerFactory.getLogger(CacheCli.class);
  private static final String MODE_CACHE = "cache";
  private static final String SUMMARY_USAGE =
      "usage: cache <info|clear> [config=PATH] [cacheDir=PATH] [olderThanHours=N]";
  private static final String HELP_TEXT = """
      RULESYNC cache maintenance

      Usage:
        cache info  [config=PATH] [cacheDir=PATH]
        cache clear [config=PATH] [cacheDir=PATH] [olderThanHours=N]

      Actions:
        info                 Print entry count, size, age range and TTL
        clear                Remove every entry, or only entries older than olderThanHours

      Options:
        config=PATH          YAML file whose common/cache sections are applied (optional)
        cacheDir=PATH        Cache directory (default temp/cache)
        cacheTtlHours=N      Freshness window reported by info (default 24)
        olderThanHours=N     Age threshold for clear
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private CacheCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the cache CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments; the first key/value token is the action
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for cache CLI");
    }

    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0 || remainder[0].contains("=")) {
      log.error("Missing cache action");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String action = remainder[0].toLowerCase(Locale.ROOT);
    if (!action.equals("info") && !action.equals("clear")) {
      log.error("Unknown cache action: {}", action);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CacheConfig config;
    try {
      Map<String, String> cliKv = new LinkedHashMap<>(
          CliArgsParser.toMap(Arrays.copyOfRange(remainder, 1, remainder.length)));
      config = CacheConfig.fromMap(effectiveConfig(cliKv));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid cache arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CachePort cache = new FileSystemCacheAdapter(config.cacheDir(), config.cacheTtl(), new SystemClockAdapter());
    try {
      if (action.equals("info")) {
        printInfo(cache.info());
      } else {
        int removed = cache.evict(config.olderThanHours().orElse(null));
        log.info("Removed {} cache entries from {}", removed, config.cacheDir());
        CliPrinter.println("Removed " + removed + " cache entries"
            + config.olderThanHours().map(h -> " older than " + h + " h").orElse(""));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Cache {} failed for {}", action, config.cacheDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure during cache {}", action, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, String> effectiveConfig(Map<String, String> cliKv) throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + path);
      }
      yaml = YamlConfigLoader.load(path, MODE_CACHE);
    }
    return ConfigMerger.buildEffectiveConfig(
        MODE_CACHE, yaml, cliKv, DefaultsForMode.asFlatMap(MODE_CACHE), log::warn);
  }

  private static void printInfo(CacheInfo info) {
    CliPrinter.report("Cache info")
        .field("Directory", info.directory())
        .field("Entries", info.fileCount())
        .field("Total size", String.format(Locale.ROOT, "%.2f MB", info.totalSizeMb()))
        .field("Oldest entry", info.oldest().map(Instant::toString).orElse("<none>"))
        .field("Newest entry", info.newest().map(Instant::toString).orElse("<none>"))
        .field("TTL", info.ttl().toHours() + " h")
        .print();
  }
}
