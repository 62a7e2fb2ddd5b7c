package ca.gc.cra.rulesync.application.fetch;

import ca.gc.cra.rulesync.application.port.ClockPort;
import ca.gc.cra.rulesync.domain.fetch.BatchProgress;
import ca.gc.cra.rulesync.domain.fetch.BatchReport;
import ca.gc.cra.rulesync.domain.fetch.BatchStats;
import ca.gc.cra.rulesync.domain.fetch.DownloadResult;
import ca.gc.cra.rulesync.domain.fetch.FetchOptions;
import ca.gc.cra.rulesync.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rulesync.logging.Logs;
import ca.gc.cra.rulesync.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Downloads a batch of URLs on a bounded worker pool and reports per-URL results plus
 * aggregate statistics.
 * <p><strong>Why:</strong> A ruleset pulls from several hosts; one slow or failing host must not hold back
 * completion reporting for the others.</p>
 * <p><strong>Concurrency:</strong>
 * <ul>
 *   <li>Each URL runs on its own task; results are taken in completion order and placed back in input
 *       order.</li>
 *   <li>Workers never touch shared counters. They post {@link ProgressEvent}s onto a queue drained by a
 *       single aggregator thread, which owns all progress state and publishes throttled
 *       {@link BatchProgress} snapshots.</li>
 *   <li>Interrupting the calling thread cancels in-flight downloads.</li>
 * </ul>
 * <p><strong>Observability:</strong> Logs one summary line per batch at INFO.</p>
 *
 * @since 0.1.0
 */
public final class DownloadCoordinator {
  private static final Logger log = LoggerFactory.getLogger(DownloadCoordinator.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 5L;
  private static final double BYTES_PER_MB = 1024d * 1024d;

  private final Fetcher fetcher;
  private final FetchOptions options;
  private final int maxConcurrent;
  private final long progressIntervalMillis;
  private final ClockPort clock;

  /**
   * Creates a coordinator.
   *
   * @param fetcher single-URL fetcher shared by all workers
   * @param options fetch policy applied to every URL
   * @param maxConcurrent worker pool size
   * @param progressIntervalMillis minimum spacing between progress snapshots
   * @param clock time source for throttling and elapsed time
   */
  public DownloadCoordinator(
      Fetcher fetcher, FetchOptions options, int maxConcurrent, long progressIntervalMillis, ClockPort clock) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.options = Objects.requireNonNull(options, "options");
    if (maxConcurrent <= 0) {
      throw new IllegalArgumentException("maxConcurrent must be positive");
    }
    if (progressIntervalMillis < 0) {
      throw new IllegalArgumentException("progressIntervalMillis must be >= 0");
    }
    this.maxConcurrent = maxConcurrent;
    this.progressIntervalMillis = progressIntervalMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Downloads every URL into {@code destDir}.
   *
   * @param urls URLs to retrieve; duplicates are fetched once per occurrence
   * @param destDir directory receiving the local copies; created when missing
   * @param progressSink receives throttled snapshots on the aggregator thread; may be {@code null}
   * @return results in input order plus aggregate statistics
   * @throws IOException when {@code destDir} cannot be created
   * @throws InterruptedException when the caller is interrupted; in-flight downloads are cancelled
   */
  public BatchReport downloadBatch(List<String> urls, Path destDir, Consumer<BatchProgress> progressSink)
      throws IOException, InterruptedException {
    Objects.requireNonNull(urls, "urls");
    Objects.requireNonNull(destDir, "destDir");
    Consumer<BatchProgress> sink = progressSink == null ? progress -> {} : progressSink;
    long startedMillis = clock.nowMillis();
    if (urls.isEmpty()) {
      return new BatchReport(List.of(), BatchStats.from(List.of(), 0d, maxConcurrent));
    }
    Files.createDirectories(destDir);
    List<Path> destinations = assignDestinations(urls, destDir);

    BlockingQueue<ProgressEvent> events = new LinkedBlockingQueue<>();
    ProgressAggregator aggregator = new ProgressAggregator(events, urls.size(), startedMillis, sink);
    Thread aggregatorThread = ExecutorFactories
        .namedThreads("rulesync-progress", (t, ex) -> log.error("Progress aggregator failed", ex))
        .newThread(aggregator);
    aggregatorThread.start();

    int poolSize = Math.min(maxConcurrent, urls.size());
    ExecutorService pool = ExecutorFactories.newBoundedPool(
        poolSize, "rulesync-fetch", (t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
    CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(pool);
    DownloadResult[] results = new DownloadResult[urls.size()];
    try {
      for (int i = 0; i < urls.size(); i++) {
        int index = i;
        String url = urls.get(i);
        completion.submit(() -> runOne(index, url, destinations.get(index), events));
      }
      for (int received = 0; received < urls.size(); received++) {
        Future<IndexedResult> future = completion.take();
        IndexedResult indexed = unwrap(future);
        results[indexed.index()] = indexed.result();
      }
    } catch (InterruptedException ex) {
      log.warn("Download batch interrupted; cancelling {} workers", poolSize);
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
      events.add(ProgressEvent.STOP);
      awaitQuietly(pool, aggregatorThread);
    }

    List<DownloadResult> ordered = Arrays.asList(results);
    double seconds = Math.max(0L, clock.nowMillis() - startedMillis) / 1000d;
    BatchStats stats = BatchStats.from(ordered, seconds, maxConcurrent);
    log.info(
        "Batch finished: {}/{} succeeded ({}%), {} MB in {} s ({} MB/s)",
        stats.successfulFiles(),
        stats.totalFiles(),
        String.format(Locale.ROOT, "%.1f", stats.successRatePercent()),
        String.format(Locale.ROOT, "%.2f", stats.totalSizeMb()),
        String.format(Locale.ROOT, "%.2f", stats.totalTimeSeconds()),
        String.format(Locale.ROOT, "%.2f", stats.averageSpeedMbps()));
    for (String failed : stats.failedUrls()) {
      log.warn("Failed source: {}", Logs.redactUrl(failed));
    }
    return new BatchReport(ordered, stats);
  }

  private IndexedResult runOne(int index, String url, Path dest, BlockingQueue<ProgressEvent> events) {
    try {
      DownloadResult result = fetcher.fetch(
          url, dest, options, (downloaded, total) -> events.add(ProgressEvent.bytes(index, downloaded)));
      return new IndexedResult(index, result);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return new IndexedResult(index, DownloadResult.failure(url, "interrupted", 0d));
    } catch (RuntimeException ex) {
      log.error("Unexpected failure downloading {}", Logs.redactUrl(url), ex);
      return new IndexedResult(index, DownloadResult.failure(url, ex.toString(), 0d));
    } finally {
      events.add(ProgressEvent.done(index));
    }
  }

  private static IndexedResult unwrap(Future<IndexedResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("download worker failed", ex.getCause());
    }
  }

  private static void awaitQuietly(ExecutorService pool, Thread aggregatorThread) throws InterruptedException {
    if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
      log.warn("Download workers did not stop within {} s", SHUTDOWN_WAIT_SECONDS);
    }
    aggregatorThread.join(TimeUnit.SECONDS.toMillis(SHUTDOWN_WAIT_SECONDS));
  }

  /**
   * Chooses a local file per URL: the last path segment when it carries an extension, otherwise
   * {@code file_<index>.txt}. A name already taken is prefixed with the URL index, and with a counter
   * when that is taken too.
   */
  static List<Path> assignDestinations(List<String> urls, Path destDir) {
    List<Path> paths = new ArrayList<>(urls.size());
    Set<String> used = new HashSet<>();
    for (int i = 0; i < urls.size(); i++) {
      String base = fileNameFor(urls.get(i), i);
      String name = base;
      for (int attempt = 0; !used.add(name); attempt++) {
        name = attempt == 0 ? i + "_" + base : i + "_" + attempt + "_" + base;
      }
      paths.add(Paths.resolveChild(destDir, name));
    }
    return paths;
  }

  static String fileNameFor(String url, int index) {
    String path = url;
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) {
      path = path.substring(0, cut);
    }
    int scheme = path.indexOf("://");
    if (scheme >= 0) {
      int firstSlash = path.indexOf('/', scheme + 3);
      path = firstSlash < 0 ? "" : path.substring(firstSlash);
    }
    String segment = path.substring(path.lastIndexOf('/') + 1);
    String sanitized = segment.replaceAll("[^A-Za-z0-9._-]", "_");
    int dot = sanitized.lastIndexOf('.');
    if (dot <= 0 || dot == sanitized.length() - 1 || sanitized.startsWith(".")) {
      return "file_" + index + ".txt";
    }
    return sanitized;
  }

  private static int indexOfAny(String value, char first, char second) {
    int a = value.indexOf(first);
    int b = value.indexOf(second);
    if (a < 0) {
      return b;
    }
    return b < 0 ? a : Math.min(a, b);
  }

  private record IndexedResult(int index, DownloadResult result) {}

  /** Message from a worker to the aggregator. */
  record ProgressEvent(Kind kind, int index, long downloadedBytes) {
    static final ProgressEvent STOP = new ProgressEvent(Kind.STOP, -1, 0L);

    enum Kind {
      BYTES,
      DONE,
      STOP
    }

    static ProgressEvent bytes(int index, long downloadedBytes) {
      return new ProgressEvent(Kind.BYTES, index, downloadedBytes);
    }

    static ProgressEvent done(int index) {
      return new ProgressEvent(Kind.DONE, index, 0L);
    }
  }

  /** Sole owner of batch progress state. */
  private final class ProgressAggregator implements Runnable {
    private final BlockingQueue<ProgressEvent> events;
    private final long[] bytesPerUrl;
    private final int totalFiles;
    private final long startedMillis;
    private final Consumer<BatchProgress> sink;
    private int completed;
    private long lastEmitMillis = Long.MIN_VALUE;

    private ProgressAggregator(
        BlockingQueue<ProgressEvent> events, int totalFiles, long startedMillis, Consumer<BatchProgress> sink) {
      this.events = events;
      this.bytesPerUrl = new long[totalFiles];
      this.totalFiles = totalFiles;
      this.startedMillis = startedMillis;
      this.sink = sink;
    }

    @Override
    public void run() {
      try {
        while (true) {
          ProgressEvent event = events.take();
          switch (event.kind()) {
            case STOP -> {
              return;
            }
            case BYTES -> {
              bytesPerUrl[event.index()] = event.downloadedBytes();
              maybeEmit(false);
            }
            case DONE -> {
              completed++;
              maybeEmit(completed == totalFiles);
            }
          }
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }

    private void maybeEmit(boolean force) {
      long now = clock.nowMillis();
      if (!force && lastEmitMillis != Long.MIN_VALUE && now - lastEmitMillis < progressIntervalMillis) {
        return;
      }
      lastEmitMillis = now;
      long bytes = 0L;
      for (long value : bytesPerUrl) {
        bytes += value;
      }
      double elapsed = Math.max(0L, now - startedMillis) / 1000d;
      double speed = elapsed > 0d ? (bytes / BYTES_PER_MB) / elapsed : 0d;
      BatchProgress progress = new BatchProgress(completed, totalFiles, bytes, speed, elapsed);
      try {
        sink.accept(progress);
      } catch (RuntimeException ex) {
        log.warn("Progress listener failed", ex);
      }
    }
  }
}
