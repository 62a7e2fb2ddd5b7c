package ca.gc.cra.rulesync.application.fetch;

import ca.gc.cra.rulesync.application.port.CachePort;
import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.application.port.ProgressListener;
import ca.gc.cra.rulesync.application.port.SourceTransport;
import ca.gc.cra.rulesync.application.port.TransportResponse;
import ca.gc.cra.rulesync.domain.fetch.DownloadResult;
import ca.gc.cra.rulesync.domain.fetch.FetchOptions;
import ca.gc.cra.rulesync.domain.fetch.FetchOutcome;
import ca.gc.cra.rulesync.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Retrieves one URL into a local file with cache read-through, bounded retries and
 * optional ranged resume.
 * <p><strong>Why:</strong> Rule sources live on heterogeneous hosts (raw file mirrors, CDNs, personal sites);
 * transient failures are common, permanent client errors are not worth retrying.</p>
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>A readable non-empty destination file short-circuits as success.</li>
 *   <li>A fresh cache entry is copied to the destination.</li>
 *   <li>Otherwise up to {@code maxRetries + 1} attempts are made; each yields a tagged {@link FetchOutcome}
 *       and the loop switches on the tag.</li>
 *   <li>The body streams into {@code <dest>.part} in 8 KiB chunks and is renamed to the destination when
 *       complete. With resume enabled, a leftover part file is continued with a {@code Range} request when the
 *       server advertises {@code Accept-Ranges: bytes}.</li>
 *   <li>Completed downloads are written through to the cache.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; one instance serves every
 * download worker as long as workers use distinct destination paths.</p>
 * <p><strong>Observability:</strong> Emits {@code fetch.cache.hit}, {@code fetch.cache.miss},
 * {@code fetch.retry}, {@code fetch.failure.fatal}, {@code fetch.failure.exhausted}, {@code fetch.bytes} and
 * {@code fetch.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class Fetcher {
  private static final Logger log = LoggerFactory.getLogger(Fetcher.class);
  static final int CHUNK_SIZE = 8192;
  static final String PART_SUFFIX = ".part";
  private static final int HTTP_PARTIAL_CONTENT = 206;
  private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;
  private static final int MAX_LOGGED_MESSAGE_BYTES = 256;

  private final SourceTransport transport;
  private final CachePort cache;
  private final MetricsPort metrics;
  private final Sleeper sleeper;

  /**
   * Creates a fetcher.
   *
   * @param transport network adapter
   * @param cache payload cache consulted when {@link FetchOptions#useCache()} is set
   * @param metrics metrics sink; {@code null} disables metrics
   * @param sleeper backoff pause
   */
  public Fetcher(SourceTransport transport, CachePort cache, MetricsPort metrics, Sleeper sleeper) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Retrieves {@code url} into {@code dest}.
   *
   * @param url remote location
   * @param dest destination file; its parent directory must exist
   * @param options retry, cache and resume policy
   * @param listener byte progress callback; may be {@code null}
   * @return result describing the local copy or the last failure
   * @throws InterruptedException when the calling thread is interrupted; partial data is kept for resume
   */
  public DownloadResult fetch(String url, Path dest, FetchOptions options, ProgressListener listener)
      throws InterruptedException {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(dest, "dest");
    Objects.requireNonNull(options, "options");
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    long started = System.nanoTime();
    String safeUrl = Logs.redactUrl(url);

    Optional<Long> existing = nonEmptySize(dest);
    if (existing.isPresent()) {
      log.debug("Destination {} already present ({} bytes); skipping {}", dest, existing.get(), safeUrl);
      return DownloadResult.success(url, dest, existing.get(), elapsedSeconds(started), false);
    }

    if (options.useCache()) {
      Optional<DownloadResult> cached = copyFromCache(url, dest, started);
      if (cached.isPresent()) {
        progress.onProgress(cached.get().sizeBytes(), cached.get().sizeBytes());
        return cached.get();
      }
    }

    Path part = dest.resolveSibling(dest.getFileName() + PART_SUFFIX);
    FetchOutcome outcome = FetchOutcome.retryable("no attempt made");
    for (int attempt = 0; attempt <= options.maxRetries(); attempt++) {
      outcome = attempt(url, part, options, progress);
      switch (outcome.status()) {
        case SUCCESS -> {
          return complete(url, part, dest, options, started);
        }
        case FATAL -> {
          log.error("Download of {} failed permanently: {}", safeUrl, outcome.message());
          metrics.increment("fetch.failure.fatal");
          deleteQuietly(part);
          return DownloadResult.failure(url, outcome.message(), elapsedSeconds(started));
        }
        case RETRYABLE -> {
          if (attempt < options.maxRetries()) {
            Duration delay = options.backoffAfter(attempt);
            log.warn(
                "Attempt {}/{} for {} failed ({}); retrying in {} ms",
                attempt + 1,
                options.maxRetries() + 1,
                safeUrl,
                outcome.message(),
                delay.toMillis());
            metrics.increment("fetch.retry");
            sleeper.sleep(delay);
          }
        }
      }
    }

    log.error(
        "Download of {} failed after {} attempts: {}", safeUrl, options.maxRetries() + 1, outcome.message());
    metrics.increment("fetch.failure.exhausted");
    if (!options.supportResume()) {
      deleteQuietly(part);
    }
    return DownloadResult.failure(url, outcome.message(), elapsedSeconds(started));
  }

  private Optional<DownloadResult> copyFromCache(String url, Path dest, long started) {
    Optional<Path> entry = cache.get(url);
    if (entry.isEmpty()) {
      metrics.increment("fetch.cache.miss");
      return Optional.empty();
    }
    try {
      Files.copy(entry.get(), dest, StandardCopyOption.REPLACE_EXISTING);
      long size = Files.size(dest);
      metrics.increment("fetch.cache.hit");
      log.info("Using cached copy of {} ({} bytes)", Logs.redactUrl(url), size);
      return Optional.of(DownloadResult.success(url, dest, size, elapsedSeconds(started), true));
    } catch (IOException ex) {
      log.warn("Unable to copy cache entry for {}; downloading instead", Logs.redactUrl(url), ex);
      metrics.increment("fetch.cache.miss");
      deleteQuietly(dest);
      return Optional.empty();
    }
  }

  FetchOutcome attempt(String url, Path part, FetchOptions options, ProgressListener progress)
      throws InterruptedException {
    long resumeFrom = resumeOffset(url, part, options);
    try (TransportResponse response = transport.get(url, resumeFrom)) {
      if (response.status() == HTTP_RANGE_NOT_SATISFIABLE && resumeFrom > 0) {
        deleteQuietly(part);
        return FetchOutcome.retryable("range not satisfiable; restarting");
      }
      if (!response.isSuccessful()) {
        if (resumeFrom == 0) {
          deleteQuietly(part);
        }
        return FetchOutcome.forHttpStatus(response.status(), "request rejected");
      }

      boolean ranged = response.status() == HTTP_PARTIAL_CONTENT && response.contentRange().isPresent();
      long rangeStart = ranged ? response.startFromContentRange().orElse(-1L) : 0L;
      if (ranged && rangeStart != 0L && rangeStart != resumeFrom) {
        log.warn("Range for {} starts at byte {} instead of {}; discarding partial download",
            Logs.redactUrl(url), rangeStart, resumeFrom);
        deleteQuietly(part);
        return FetchOutcome.retryable("unexpected range start " + rangeStart);
      }
      boolean append = ranged && resumeFrom > 0 && rangeStart == resumeFrom;
      long offset = append ? resumeFrom : 0L;
      long total = ranged
          ? response.totalFromContentRange().orElse(-1L)
          : response.contentLength().orElse(-1L);
      if (append) {
        log.info("Resuming {} from byte {}", Logs.redactUrl(url), offset);
      } else if (resumeFrom > 0) {
        log.debug("Server ignored range request for {}; restarting from byte 0", Logs.redactUrl(url));
      }

      long downloaded = stream(response.body(), part, append, offset, total, progress);
      if (downloaded == 0L) {
        deleteQuietly(part);
        return FetchOutcome.retryable("empty response");
      }
      if (total > 0 && downloaded > total) {
        deleteQuietly(part);
        return FetchOutcome.retryable("body longer than expected (" + downloaded + " of " + total + " bytes)");
      }
      if (total > 0 && downloaded < total) {
        return FetchOutcome.retryable("incomplete body (" + downloaded + " of " + total + " bytes)");
      }
      return FetchOutcome.success(downloaded);
    } catch (InterruptedIOException ex) {
      if (Thread.interrupted()) {
        throw new InterruptedException("download interrupted: " + Logs.redactUrl(url));
      }
      return retryableIoFailure(part, resumeFrom, ex);
    } catch (IOException ex) {
      return retryableIoFailure(part, resumeFrom, ex);
    }
  }

  private long resumeOffset(String url, Path part, FetchOptions options) throws InterruptedException {
    Optional<Long> partial = nonEmptySize(part);
    if (partial.isEmpty()) {
      return 0L;
    }
    if (!options.supportResume()) {
      deleteQuietly(part);
      return 0L;
    }
    try {
      if (transport.supportsRanges(url)) {
        return partial.get();
      }
      log.debug("{} does not advertise byte ranges; discarding partial download", Logs.redactUrl(url));
    } catch (IOException ex) {
      log.debug("Range support check for {} failed; restarting from byte 0", Logs.redactUrl(url), ex);
    }
    deleteQuietly(part);
    return 0L;
  }

  private static long stream(
      InputStream body, Path part, boolean append, long offset, long total, ProgressListener progress)
      throws IOException, InterruptedException {
    StandardOpenOption[] openOptions = append
        ? new StandardOpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.APPEND}
        : new StandardOpenOption[] {
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};
    long downloaded = offset;
    byte[] buffer = new byte[CHUNK_SIZE];
    try (OutputStream out = Files.newOutputStream(part, openOptions)) {
      int read;
      while ((read = body.read(buffer)) != -1) {
        if (Thread.interrupted()) {
          throw new InterruptedException("download interrupted");
        }
        out.write(buffer, 0, read);
        downloaded += read;
        progress.onProgress(downloaded, total);
      }
    }
    return downloaded;
  }

  private DownloadResult complete(String url, Path part, Path dest, FetchOptions options, long started) {
    long size;
    try {
      Files.move(part, dest, StandardCopyOption.REPLACE_EXISTING);
      size = Files.size(dest);
    } catch (IOException ex) {
      log.error("Unable to finalize download of {} into {}", Logs.redactUrl(url), dest, ex);
      deleteQuietly(part);
      return DownloadResult.failure(url, "unable to finalize download: " + ex.getMessage(), elapsedSeconds(started));
    }
    if (options.useCache()) {
      try {
        cache.put(url, dest);
      } catch (IOException ex) {
        log.warn("Unable to cache {}; continuing without cache entry", Logs.redactUrl(url), ex);
      }
    }
    double seconds = elapsedSeconds(started);
    metrics.observe("fetch.bytes", size);
    metrics.observe("fetch.latencyMillis", (long) (seconds * 1000d));
    log.info("Downloaded {} ({} bytes in {} s)", Logs.redactUrl(url), size, String.format("%.2f", seconds));
    return DownloadResult.success(url, dest, size, seconds, false);
  }

  private static FetchOutcome retryableIoFailure(Path part, long resumeFrom, IOException ex) {
    if (resumeFrom == 0) {
      deleteQuietly(part);
    }
    String message = ex.getClass().getSimpleName()
        + (ex.getMessage() == null ? "" : ": " + Logs.truncate(ex.getMessage(), MAX_LOGGED_MESSAGE_BYTES));
    return FetchOutcome.retryable(message);
  }

  private static Optional<Long> nonEmptySize(Path file) {
    try {
      if (Files.isRegularFile(file) && Files.isReadable(file)) {
        long size = Files.size(file);
        if (size > 0) {
          return Optional.of(size);
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to stat {}", file, ex);
    }
    return Optional.empty();
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Unable to delete {}", file, ex);
    }
  }

  private static double elapsedSeconds(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000_000d;
  }
}
