package io.github.randomcodespace.ephemeral.readiness;

import java.time.Duration;
import lombok.Getter;
import lombok.ToString;

/**
 * Attempt budget and constant interval for a readiness poll. The worst-case wait is roughly
 * {@code (maxAttempts - 1) * interval} plus the time spent in the describe calls.
 */
@Getter
@ToString
public final class PollingPolicy {
  private final int maxAttempts; // Total describe calls, including the first
  private final Duration interval;

  private PollingPolicy(int maxAttempts, Duration interval) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    if (interval == null || interval.toMillis() < 1) {
      throw new IllegalArgumentException("interval must be at least 1 ms, got " + interval);
    }
    this.maxAttempts = maxAttempts;
    this.interval = interval;
  }

  public static PollingPolicy of(int maxAttempts, Duration interval) {
    return new PollingPolicy(maxAttempts, interval);
  }

  public Duration getWorstCaseWait() {
    return interval.multipliedBy(maxAttempts - 1L);
  }
}
