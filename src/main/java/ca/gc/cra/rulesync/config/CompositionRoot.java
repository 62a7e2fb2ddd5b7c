package ca.gc.cra.rulesync.config;

import ca.gc.cra.rulesync.application.fetch.DownloadCoordinator;
import ca.gc.cra.rulesync.application.fetch.Fetcher;
import ca.gc.cra.rulesync.application.fetch.Sleeper;
import ca.gc.cra.rulesync.application.merge.LineListParser;
import ca.gc.cra.rulesync.application.merge.RuleFilter;
import ca.gc.cra.rulesync.application.merge.RulesetMerger;
import ca.gc.cra.rulesync.application.merge.StructuredFragmentParser;
import ca.gc.cra.rulesync.application.pipeline.RulesetSyncUseCase;
import ca.gc.cra.rulesync.application.port.CachePort;
import ca.gc.cra.rulesync.application.port.ClockPort;
import ca.gc.cra.rulesync.application.port.CompilerPort;
import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.application.port.SourceTransport;
import ca.gc.cra.rulesync.infrastructure.cache.FileSystemCacheAdapter;
import ca.gc.cra.rulesync.infrastructure.compiler.ExternalProcessCompilerAdapter;
import ca.gc.cra.rulesync.infrastructure.http.JdkHttpSourceTransport;
import ca.gc.cra.rulesync.infrastructure.output.CanonicalJsonWriter;
import ca.gc.cra.rulesync.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the sync use case to its concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter construction out of the CLI so tests can swap the transport and
 * metrics sink.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 * @see RulesetSyncUseCase
 */
public final class CompositionRoot {
  private final SyncConfig config;
  private final MetricsPort metrics;
  private final SourceTransport transport;
  private final ClockPort clock;

  /**
   * Creates a root that talks HTTP through the JDK client.
   *
   * @param config effective sync settings
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(SyncConfig config, MetricsPort metrics) {
    this(config, metrics,
        new JdkHttpSourceTransport(config.requestTimeout(), config.userAgent()),
        new SystemClockAdapter());
  }

  /**
   * Creates a root with an explicit transport and clock.
   *
   * @param config effective sync settings
   * @param metrics metrics sink shared by every component
   * @param transport HTTP transport used by the fetcher
   * @param clock time source for cache freshness and progress
   */
  public CompositionRoot(SyncConfig config, MetricsPort metrics, SourceTransport transport, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the on-disk download cache.
   *
   * @return cache adapter rooted at {@code cacheDir}
   */
  public CachePort cache() {
    return new FileSystemCacheAdapter(config.cacheDir(), config.cacheTtl(), clock);
  }

  /**
   * Builds the external compiler, or a no-op when no command is configured.
   *
   * @return compiler port
   */
  public CompilerPort compiler() {
    return config.compilerCommand()
        .<CompilerPort>map(command ->
            new ExternalProcessCompilerAdapter(command, config.compiledDir(), config.compilerTimeout()))
        .orElse(CompilerPort.NONE);
  }

  /**
   * Builds the full sync pipeline.
   *
   * @return use case ready to run a catalog
   */
  public RulesetSyncUseCase syncUseCase() {
    CachePort cache = cache();
    Fetcher fetcher = new Fetcher(transport, cache, metrics, Sleeper.SYSTEM);
    DownloadCoordinator coordinator = new DownloadCoordinator(
        fetcher, config.fetchOptions(), config.concurrency(), config.progressIntervalMillis(), clock);
    RulesetMerger merger = new RulesetMerger(
        new StructuredFragmentParser(), new LineListParser(), metrics, config.validateCidr());
    return new RulesetSyncUseCase(
        config,
        coordinator,
        merger,
        new RuleFilter(config.denylist(), metrics),
        new CanonicalJsonWriter(),
        compiler(),
        cache,
        metrics,
        clock);
  }
}
