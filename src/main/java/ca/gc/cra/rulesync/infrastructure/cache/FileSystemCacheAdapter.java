package ca.gc.cra.rulesync.infrastructure.cache;

import ca.gc.cra.rulesync.application.port.CachePort;
import ca.gc.cra.rulesync.application.port.ClockPort;
import ca.gc.cra.rulesync.domain.fetch.CacheInfo;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CachePort} storing one {@code <md5(url)>.cache} file per URL.
 * <p><strong>Why:</strong> File modification time doubles as the freshness timestamp, so the cache needs no
 * index and survives process restarts.</p>
 * <p><strong>Thread-safety:</strong> Entries are written to a temporary file in the cache directory and moved
 * into place atomically; concurrent readers see the previous entry or nothing.</p>
 * <p><strong>Observability:</strong> Logs hits and expiries at DEBUG, unreadable entries at WARN.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemCacheAdapter implements CachePort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemCacheAdapter.class);
  static final String ENTRY_SUFFIX = ".cache";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path directory;
  private final Duration ttl;
  private final ClockPort clock;

  /**
   * Creates a cache rooted at {@code directory}.
   *
   * @param directory cache directory; created lazily on first write
   * @param ttl freshness window; entries at least this old are misses
   * @param clock time source for freshness checks
   */
  public FileSystemCacheAdapter(Path directory, Duration ttl, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
  }

  @Override
  public Optional<Path> get(String url) {
    Path entry = entryFor(url);
    try {
      BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
      if (!attrs.isRegularFile() || attrs.size() <= 0) {
        log.debug("Cache entry for {} is empty; treating as miss", url);
        return Optional.empty();
      }
      long ageMillis = clock.nowMillis() - attrs.lastModifiedTime().toMillis();
      if (ageMillis >= ttl.toMillis()) {
        log.debug("Cache entry for {} expired ({} ms old)", url, ageMillis);
        return Optional.empty();
      }
      if (!Files.isReadable(entry)) {
        log.warn("Cache entry {} is not readable; ignoring", entry);
        return Optional.empty();
      }
      log.debug("Cache hit for {}", url);
      return Optional.of(entry);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    } catch (IOException ex) {
      log.warn("Unable to inspect cache entry {}; treating as miss", entry, ex);
      return Optional.empty();
    }
  }

  @Override
  public void put(String url, Path source) throws IOException {
    Objects.requireNonNull(source, "source");
    Files.createDirectories(directory);
    Path entry = entryFor(url);
    Path temp = Files.createTempFile(directory, keyFor(url), TEMP_SUFFIX);
    try {
      Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
      moveIntoPlace(temp, entry);
      log.debug("Cached {} ({} bytes)", url, Files.size(entry));
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public int evict(Integer olderThanHours) throws IOException {
    if (olderThanHours != null && olderThanHours < 0) {
      throw new IllegalArgumentException("olderThanHours must be >= 0");
    }
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    long now = clock.nowMillis();
    int removed = 0;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path file : stream) {
        String name = file.getFileName().toString();
        boolean entry = name.endsWith(ENTRY_SUFFIX);
        if (!entry && !name.endsWith(TEMP_SUFFIX)) {
          continue;
        }
        if (olderThanHours != null) {
          long age = now - Files.getLastModifiedTime(file).toMillis();
          if (age <= Duration.ofHours(olderThanHours).toMillis()) {
            continue;
          }
        }
        if (Files.deleteIfExists(file) && entry) {
          removed++;
        }
      }
    }
    log.info("Removed {} cache entries from {}", removed, directory);
    return removed;
  }

  @Override
  public CacheInfo info() throws IOException {
    if (!Files.isDirectory(directory)) {
      return new CacheInfo(directory, 0, 0L, Optional.empty(), Optional.empty(), ttl);
    }
    int count = 0;
    long bytes = 0L;
    Instant oldest = null;
    Instant newest = null;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + ENTRY_SUFFIX)) {
      for (Path file : stream) {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        Instant modified = attrs.lastModifiedTime().toInstant();
        count++;
        bytes += attrs.size();
        if (oldest == null || modified.isBefore(oldest)) {
          oldest = modified;
        }
        if (newest == null || modified.isAfter(newest)) {
          newest = modified;
        }
      }
    }
    return new CacheInfo(directory, count, bytes, Optional.ofNullable(oldest), Optional.ofNullable(newest), ttl);
  }

  Path entryFor(String url) {
    return directory.resolve(keyFor(url) + ENTRY_SUFFIX);
  }

  static String keyFor(String url) {
    Objects.requireNonNull(url, "url");
    try {
      MessageDigest md5 = MessageDigest.getInstance("MD5");
      return HexFormat.of().formatHex(md5.digest(url.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }

  private static void moveIntoPlace(Path temp, Path entry) throws IOException {
    try {
      Files.move(temp, entry, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", entry);
      Files.move(temp, entry, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
