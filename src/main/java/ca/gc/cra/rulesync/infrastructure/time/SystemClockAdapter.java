package ca.gc.cra.rulesync.infrastructure.time;

import ca.gc.cra.rulesync.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}, used by the CLI wiring for cache freshness and
 * batch timing.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
