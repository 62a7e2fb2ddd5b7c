package ca.gc.cra.rulesync.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to cache freshness checks and batch timing.
 * <p><strong>Why:</strong> Cache TTL decisions and progress throttling must be testable without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; download workers read the clock
 * concurrently.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.rulesync.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
