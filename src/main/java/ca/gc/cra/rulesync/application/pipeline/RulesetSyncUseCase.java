package ca.gc.cra.rulesync.application.pipeline;

import ca.gc.cra.rulesync.application.fetch.DownloadCoordinator;
import ca.gc.cra.rulesync.application.merge.FetchedSource;
import ca.gc.cra.rulesync.application.merge.MergeReport;
import ca.gc.cra.rulesync.application.merge.RuleFilter;
import ca.gc.cra.rulesync.application.merge.RulesetMerger;
import ca.gc.cra.rulesync.application.merge.SourceClassifier;
import ca.gc.cra.rulesync.application.port.CachePort;
import ca.gc.cra.rulesync.application.port.ClockPort;
import ca.gc.cra.rulesync.application.port.CompilerPort;
import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.application.port.RulesetWriterPort;
import ca.gc.cra.rulesync.config.RulesetCatalog;
import ca.gc.cra.rulesync.config.SyncConfig;
import ca.gc.cra.rulesync.domain.fetch.BatchProgress;
import ca.gc.cra.rulesync.domain.fetch.BatchReport;
import ca.gc.cra.rulesync.domain.fetch.DownloadResult;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.source.Source;
import ca.gc.cra.rulesync.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rulesync.logging.Logs;
import ca.gc.cra.rulesync.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the fetch, merge, filter, write and compile pipeline for every ruleset of a
 * catalog.
 * <p><strong>Why:</strong> One entry point gives the CLI a single {@link SyncSummary} to report and map to an
 * exit code.</p>
 * <p><strong>Flow per ruleset:</strong>
 * <ol>
 *   <li>Classify each URL and download the batch into {@code <workDir>/<name>}.</li>
 *   <li>Merge the successful payloads; unparsable payloads are excluded.</li>
 *   <li>Apply the denylist, write {@code <outputDir>/<name>.json}, then compile when a compiler is set.</li>
 *   <li>Remove the download directory unless work files are kept.</li>
 * </ol>
 * A ruleset with no downloaded or parsable source fails alone; the run continues with the next one.</p>
 * <p><strong>Concurrency:</strong> Rulesets run one at a time unless {@code rulesetParallelism} is above one.
 * Each ruleset owns its merge state, so parallel rulesets share nothing but the cache and the metrics sink.</p>
 * <p><strong>Observability:</strong> The MDC key {@code ruleset} is set while a ruleset is processed;
 * {@code ruleset.success} and {@code ruleset.failure} count outcomes.</p>
 *
 * @since 0.1.0
 */
public final class RulesetSyncUseCase {
  private static final Logger log = LoggerFactory.getLogger(RulesetSyncUseCase.class);
  static final String MDC_RULESET = "ruleset";
  private static final String JSON_EXTENSION = ".json";

  private final SyncConfig config;
  private final DownloadCoordinator coordinator;
  private final RulesetMerger merger;
  private final RuleFilter filter;
  private final RulesetWriterPort writer;
  private final CompilerPort compiler;
  private final CachePort cache;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param config run settings
   * @param coordinator batch downloader
   * @param merger payload merger
   * @param filter denylist filter
   * @param writer canonical JSON writer
   * @param compiler external compiler, or {@link CompilerPort#NONE}
   * @param cache download cache, pruned when the run starts
   * @param metrics metrics sink
   * @param clock time source for the run duration
   */
  public RulesetSyncUseCase(
      SyncConfig config,
      DownloadCoordinator coordinator,
      RulesetMerger merger,
      RuleFilter filter,
      RulesetWriterPort writer,
      CompilerPort compiler,
      CachePort cache,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.merger = Objects.requireNonNull(merger, "merger");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Syncs every ruleset of {@code catalog}.
   *
   * @param catalog rulesets to process, in order
   * @return run totals
   * @throws InterruptedException when the run is interrupted; in-flight downloads are cancelled
   * @throws IllegalArgumentException when an output directory is unusable
   */
  public SyncSummary run(RulesetCatalog catalog) throws InterruptedException {
    Objects.requireNonNull(catalog, "catalog");
    long started = clock.nowMillis();
    Paths.validateWritableDir(config.outputDir(), true);
    pruneCache();

    List<Map.Entry<String, List<String>>> rulesets = new ArrayList<>(catalog.rulesets().entrySet());
    log.info("Syncing {} rulesets from {} sources", rulesets.size(), catalog.sourceCount());
    List<RulesetOutcome> outcomes = config.rulesetParallelism() > 1 && rulesets.size() > 1
        ? runParallel(rulesets)
        : runSequential(rulesets);

    SyncSummary summary = SyncSummary.from(outcomes, Math.max(0L, clock.nowMillis() - started) / 1000d);
    logSummary(summary);
    return summary;
  }

  /**
   * Syncs a single ruleset.
   *
   * @param name ruleset name, used for the work directory and the output file
   * @param urls source URLs
   * @return outcome; failures are reported in the outcome rather than thrown
   * @throws InterruptedException when interrupted while downloading or compiling
   */
  public RulesetOutcome syncRuleset(String name, List<String> urls) throws InterruptedException {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(urls, "urls");
    String previous = MDC.get(MDC_RULESET);
    MDC.put(MDC_RULESET, name);
    Path workDir = Paths.resolveChild(config.workDir(), name);
    try {
      RulesetOutcome outcome = process(name, urls, workDir);
      metrics.increment(outcome.success() ? "ruleset.success" : "ruleset.failure");
      return outcome;
    } finally {
      if (!config.keepWorkFiles()) {
        deleteTree(workDir);
      }
      if (previous == null) {
        MDC.remove(MDC_RULESET);
      } else {
        MDC.put(MDC_RULESET, previous);
      }
    }
  }

  private RulesetOutcome process(String name, List<String> urls, Path workDir) throws InterruptedException {
    List<Source> sources = new ArrayList<>(urls.size());
    for (String url : urls) {
      sources.add(SourceClassifier.classify(url));
    }
    BatchReport batch;
    try {
      batch = coordinator.downloadBatch(urls, workDir, progress -> logProgress(name, progress));
    } catch (IOException ex) {
      log.error("Cannot prepare download directory for {}", name, ex);
      return RulesetOutcome.failure(name, Optional.empty(), 0, "download directory: " + ex.getMessage());
    }
    if (!batch.stats().anySucceeded()) {
      log.error("No source of {} could be downloaded", name);
      return RulesetOutcome.failure(name, Optional.of(batch.stats()), 0, "no source downloaded");
    }

    List<FetchedSource> fetched = new ArrayList<>();
    for (int i = 0; i < batch.results().size(); i++) {
      DownloadResult result = batch.results().get(i);
      if (result.success() && result.localPath().isPresent()) {
        fetched.add(new FetchedSource(sources.get(i), result.localPath().get()));
      }
    }
    MergeReport merge = merger.merge(fetched, config.version());
    int unparsable = merge.failedSources().size();
    if (merge.mergedSources() == 0) {
      log.error("No source of {} could be parsed", name);
      return RulesetOutcome.failure(name, Optional.of(batch.stats()), unparsable, "no source could be parsed");
    }
    RuleFilter.FilterResult filtered = filter.filter(merge.ruleset());
    MergedRuleset ruleset = filtered.ruleset();
    if (ruleset.isEmpty()) {
      log.warn("Ruleset {} has no rules after merging and filtering", name);
      return RulesetOutcome.failure(name, Optional.of(batch.stats()), unparsable, "no rules after filtering");
    }

    Path output = Paths.resolveChild(config.outputDir(), name + JSON_EXTENSION);
    long bytes;
    try {
      bytes = writer.write(ruleset, output);
    } catch (IOException ex) {
      log.error("Failed to write {}", output, ex);
      return RulesetOutcome.failure(name, Optional.of(batch.stats()), unparsable, "write failed: " + ex.getMessage());
    }
    Optional<Path> compiled = Optional.empty();
    Optional<String> compileError = Optional.empty();
    try {
      compiled = compiler.compile(output);
    } catch (IOException ex) {
      log.error("Compilation of {} failed: {}", name, Logs.truncate(ex.getMessage(), 512));
      compileError = Optional.of(String.valueOf(ex.getMessage()));
    }
    RulesetOutcome outcome = new RulesetOutcome(name, true, Optional.of(output), compiled,
        Optional.of(batch.stats()), merge.mergedSources(), unparsable, ruleset.ruleCount(),
        ruleset.typeBreakdown(), filtered.filteredCount(), bytes, Optional.empty(), compileError);
    log.info("Ruleset {} written: {} rules [{}], {} filtered, {} bytes",
        name, outcome.ruleCount(), outcome.breakdownText(), outcome.filteredCount(), bytes);
    return outcome;
  }

  private List<RulesetOutcome> runSequential(List<Map.Entry<String, List<String>>> rulesets)
      throws InterruptedException {
    List<RulesetOutcome> outcomes = new ArrayList<>(rulesets.size());
    for (Map.Entry<String, List<String>> entry : rulesets) {
      outcomes.add(syncRuleset(entry.getKey(), entry.getValue()));
    }
    return outcomes;
  }

  private List<RulesetOutcome> runParallel(List<Map.Entry<String, List<String>>> rulesets)
      throws InterruptedException {
    int size = Math.min(config.rulesetParallelism(), rulesets.size());
    ExecutorService pool = ExecutorFactories.newBoundedPool(
        size, "rulesync-ruleset", (t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
    List<Future<RulesetOutcome>> futures = new ArrayList<>(rulesets.size());
    try {
      for (Map.Entry<String, List<String>> entry : rulesets) {
        Callable<RulesetOutcome> task = () -> syncRuleset(entry.getKey(), entry.getValue());
        futures.add(pool.submit(task));
      }
      List<RulesetOutcome> outcomes = new ArrayList<>(futures.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(rulesets.get(i).getKey(), futures.get(i)));
      }
      return outcomes;
    } catch (InterruptedException ex) {
      log.warn("Sync interrupted; cancelling ruleset workers");
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
    }
  }

  private static RulesetOutcome await(String name, Future<RulesetOutcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof InterruptedException interrupted) {
        throw interrupted;
      }
      log.error("Ruleset {} failed unexpectedly", name, cause);
      return RulesetOutcome.failure(name, Optional.empty(), 0, String.valueOf(cause));
    }
  }

  private void pruneCache() {
    if (!config.useCache()) {
      return;
    }
    try {
      int removed = cache.evict(config.cacheEvictHours());
      if (removed > 0) {
        log.info("Pruned {} cache entries older than {} h", removed, config.cacheEvictHours());
      }
    } catch (IOException ex) {
      log.warn("Cache pruning failed; continuing with existing entries", ex);
    }
  }

  private void logProgress(String name, BatchProgress progress) {
    log.info("{}: {}/{} files ({}%), {} MB/s",
        name,
        progress.completedFiles(),
        progress.totalFiles(),
        String.format(Locale.ROOT, "%.0f", progress.percentComplete()),
        String.format(Locale.ROOT, "%.2f", progress.speedMbps()));
  }

  private static void logSummary(SyncSummary summary) {
    log.info("Sync finished in {} s: {}/{} rulesets, {}/{} downloads, {} compiled, {} rules, {} bytes",
        String.format(Locale.ROOT, "%.1f", summary.elapsedSeconds()),
        summary.successfulRulesets(),
        summary.totalRulesets(),
        summary.successfulDownloads(),
        summary.totalDownloads(),
        summary.compiledRulesets(),
        summary.totalRules(),
        summary.totalOutputBytes());
    for (String error : summary.errors()) {
      log.warn("Error: {}", error);
    }
  }

  private static void deleteTree(Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(root)) {
      List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
      for (Path path : paths) {
        Files.deleteIfExists(path);
      }
    } catch (IOException ex) {
      log.warn("Could not remove work directory {}", root, ex);
    }
  }
}
