package ca.gc.cra.rulesync.domain.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-request retrieval policy.
 *
 * @param maxRetries retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param baseDelay backoff base; attempt {@code n} (zero-based) waits {@code baseDelay * 2^n} before the next one
 * @param useCache whether the cache is consulted before the network and refreshed afterwards
 * @param supportResume whether partial local files are continued with ranged requests
 */
public record FetchOptions(int maxRetries, Duration baseDelay, boolean useCache, boolean supportResume) {
  public FetchOptions {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(baseDelay, "baseDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
  }

  /**
   * Three retries starting at one second, cache and resume enabled.
   *
   * @return default options
   */
  public static FetchOptions defaults() {
    return new FetchOptions(3, Duration.ofSeconds(1), true, true);
  }

  /**
   * Backoff to wait after the zero-based {@code attempt} failed.
   *
   * @param attempt zero-based attempt index
   * @return delay before the next attempt
   */
  public Duration backoffAfter(int attempt) {
    long factor = 1L << Math.min(attempt, 20);
    return baseDelay.multipliedBy(factor);
  }
}
