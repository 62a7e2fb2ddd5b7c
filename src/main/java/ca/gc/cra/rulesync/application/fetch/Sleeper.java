package ca.gc.cra.rulesync.application.fetch;

import java.time.Duration;

/**
 * Blocking pause between retry attempts; replaced in tests to observe backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  /** Sleeps on the calling thread. */
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
