package ca.gc.cra.rulesync.api;

import ca.gc.cra.rulesync.application.merge.SourceClassifier;
import ca.gc.cra.rulesync.application.pipeline.RulesetOutcome;
import ca.gc.cra.rulesync.application.pipeline.RulesetSyncUseCase;
import ca.gc.cra.rulesync.application.pipeline.SyncSummary;
import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.config.CompositionRoot;
import ca.gc.cra.rulesync.config.ConfigMerger;
import ca.gc.cra.rulesync.config.DefaultsForMode;
import ca.gc.cra.rulesync.config.RulesetCatalog;
import ca.gc.cra.rulesync.config.RulesetCatalogLoader;
import ca.gc.cra.rulesync.config.SyncConfig;
import ca.gc.cra.rulesync.config.YamlConfigLoader;
import ca.gc.cra.rulesync.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rulesync.logging.LoggingConfigurator;
import ca.gc.cra.rulesync.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code sync} command: downloads, merges and writes every configured ruleset.
 *
 * @since 0.1.0
 */
public final class SyncCli {
  private static final Logger log = LoggerFactory.getLogger(SyncCli.class);
  private static final String MODE_SYNC = "sync";
  private static final String SUMMARY_USAGE =
      "usage: sync [config=PATH] [only=NAME,...] [key=value ...] [--dry-run] [--no-cache] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      RULESYNC sync pipeline

      Usage:
        sync [config=PATH] [options]

      Configuration:
        config=PATH                 YAML file with common/sync sections and the rulesets catalog
                                    (default rulesync.yaml)
        only=NAME[,NAME...]         Sync only the named rulesets
        key=value                   Override any sync setting, for example concurrency=8 version=2

      Common settings:
        cacheDir=PATH               Download cache (default temp/cache)
        cacheTtlHours=N             Cache freshness window (default 24)
        outputDir=PATH              Canonical JSON output directory (default output/json)
        concurrency=N               Parallel downloads per ruleset, 1-64 (default 5)
        maxRetries=N                Retries per URL, 0-10 (default 3)
        denylist=a,b                Values containing any entry are removed (default ruleset.skk.moe)
        validateCidr=true|false     Drop malformed ip_cidr values (default false)
        compilerCommand=CMD         External compiler; {input} and {output} are substituted
        metricsExporter=otlp|none   Metrics exporter (default none)

      Flags:
        --dry-run                   Print the plan without downloading anything
        --no-cache                  Ignore and do not refresh the download cache
        --verbose                   Enable DEBUG logging
        --quiet                     Log warnings and errors only
        --help                      Show this message
      """;

  private SyncCli() {}

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
   * Executes the sync CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, config -> new OpenTelemetryMetricsAdapter(), CompositionRoot::new);
  }

  static ExitCode run(
      String[] args,
      Function<SyncConfig, MetricsPort> metricsFactory,
      RootFactory rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    configureLogging(input);

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath = ConfigCliUtils.configPathOrDefault(ConfigCliUtils.extractConfigPath(cliKv));
    if (!Files.exists(configPath)) {
      log.error("Configuration file does not exist: {}", configPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    RulesetCatalog catalog;
    try {
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(configPath, MODE_SYNC);
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE_SYNC, yaml, cliKv, DefaultsForMode.asFlatMap(MODE_SYNC), log::warn));
      catalog = RulesetCatalogLoader.load(configPath);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration in {}: {}", configPath, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    SyncConfig config;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = SyncConfig.fromMap(effective);
      if (input.hasFlag("--no-cache")) {
        config = config.withoutCache();
      }
      catalog = catalog.select(config.only());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sync arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run") || config.dryRun()) {
      printDryRunPlan(configPath, config, catalog);
      return ExitCode.SUCCESS;
    }

    log.info("Configured sync: {} rulesets, outputDir={}, cacheDir={}, useCache={}, concurrency={}",
        catalog.rulesets().size(), config.outputDir(), config.cacheDir(), config.useCache(), config.concurrency());
    return executeSync(config, catalog, metricsFactory, rootFactory);
  }

  private static void configureLogging(CliInput input) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sync CLI");
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
  }

  private static ExitCode executeSync(
      SyncConfig config,
      RulesetCatalog catalog,
      Function<SyncConfig, MetricsPort> metricsFactory,
      RootFactory rootFactory) {
    MetricsPort metrics = metricsFactory.apply(config);
    if (metrics instanceof OpenTelemetryMetricsAdapter otel && otel.isExporting()) {
      log.info("Exporting sync metrics through OpenTelemetry");
    }
    try {
      RulesetSyncUseCase useCase = rootFactory.create(config, metrics).syncUseCase();
      SyncSummary summary = useCase.run(catalog);
      printSummary(summary);
      if (!summary.isSuccess()) {
        log.error("No ruleset produced an artifact");
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Sync configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Sync interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in sync pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (metrics instanceof AutoCloseable closeable) {
        closeQuietly(closeable);
      }
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics exporter", ex);
    }
  }

  private static void printDryRunPlan(Path configPath, SyncConfig config, RulesetCatalog catalog) {
    CliPrinter.Report plan = CliPrinter.report("Sync dry-run: nothing will be downloaded or written.")
        .field("Config file", configPath)
        .field("Version", config.version())
        .field("Cache", config.useCache()
            ? config.cacheDir() + " (ttl " + config.cacheTtl().toHours() + " h, prune after "
                + config.cacheEvictHours() + " h)"
            : "disabled")
        .field("Work directory", config.workDir() + (config.keepWorkFiles() ? " (kept)" : ""))
        .field("Output directory", config.outputDir())
        .field("Compiler", config.compilerCommand()
            .map(command -> Logs.truncate(command, 120) + " -> " + config.compiledDir())
            .orElse("<none>"))
        .field("Concurrency", config.concurrency() + " downloads, " + config.rulesetParallelism() + " rulesets")
        .field("Denylist", config.denylist().isEmpty() ? "<none>" : String.join(",", config.denylist()));
    for (Map.Entry<String, List<String>> entry : catalog.rulesets().entrySet()) {
      plan.line(" Ruleset " + entry.getKey() + " (" + entry.getValue().size() + " sources) -> "
          + config.outputDir().resolve(entry.getKey() + ".json"));
      for (String url : entry.getValue()) {
        plan.line("   [" + SourceClassifier.classify(url).kind() + "] " + Logs.redactUrl(url));
      }
    }
    plan.line(" Re-run without --dry-run to sync.").print();
  }

  private static void printSummary(SyncSummary summary) {
    CliPrinter.Report report = CliPrinter.report("Sync summary")
        .field("Rulesets", summary.successfulRulesets() + "/" + summary.totalRulesets() + " succeeded")
        .field("Downloads", summary.successfulDownloads() + "/" + summary.totalDownloads() + " succeeded")
        .field("Compiled", summary.compiledRulesets())
        .field("Rules written", summary.totalRules())
        .field("Output size", String.format(Locale.ROOT, "%.2f KB", summary.totalOutputBytes() / 1024d))
        .field("Elapsed", String.format(Locale.ROOT, "%.1f s", summary.elapsedSeconds()));
    for (RulesetOutcome outcome : summary.outcomes()) {
      if (outcome.success()) {
        report.line("  + " + outcome.name() + ": " + outcome.ruleCount() + " rules [" + outcome.breakdownText()
            + "], " + outcome.filteredCount() + " filtered");
      } else {
        report.line("  - " + outcome.name() + ": " + outcome.error().orElse("failed"));
      }
    }
    for (String error : summary.errors()) {
      report.line(" Error: " + error);
    }
    report.print();
  }

  /** Builds the composition root; tests substitute one backed by fakes. */
  @FunctionalInterface
  interface RootFactory {
    CompositionRoot create(SyncConfig config, MetricsPort metrics);
  }
}
