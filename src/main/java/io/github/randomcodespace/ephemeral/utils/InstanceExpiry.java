package io.github.randomcodespace.ephemeral.utils;

import io.github.randomcodespace.ephemeral.dto.ManagedInstance;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expiry helpers for callers that track instances themselves. A record is expired iff {@code now
 * >= createdAt + ttl}; the boundary instant counts as expired. Nothing in the orchestration path
 * calls these.
 */
public final class InstanceExpiry {

  private InstanceExpiry() {}

  public static boolean isExpired(ManagedInstance instance) {
    return isExpired(instance, nowEpochSeconds());
  }

  public static boolean isExpired(ManagedInstance instance, long nowEpochSeconds) {
    return nowEpochSeconds >= instance.getExpiresAt();
  }

  /**
   * @return seconds until expiry; zero or negative once expired.
   */
  public static long getTimeToExpiry(ManagedInstance instance) {
    return getTimeToExpiry(instance, nowEpochSeconds());
  }

  public static long getTimeToExpiry(ManagedInstance instance, long nowEpochSeconds) {
    return instance.getExpiresAt() - nowEpochSeconds;
  }

  public static List<ManagedInstance> filterExpired(Collection<ManagedInstance> instances) {
    return filterExpired(instances, nowEpochSeconds());
  }

  public static List<ManagedInstance> filterExpired(
      Collection<ManagedInstance> instances, long nowEpochSeconds) {
    return instances.stream()
        .filter(instance -> isExpired(instance, nowEpochSeconds))
        .collect(Collectors.toList());
  }

  public static List<ManagedInstance> filterActive(Collection<ManagedInstance> instances) {
    return filterActive(instances, nowEpochSeconds());
  }

  public static List<ManagedInstance> filterActive(
      Collection<ManagedInstance> instances, long nowEpochSeconds) {
    return instances.stream()
        .filter(instance -> !isExpired(instance, nowEpochSeconds))
        .collect(Collectors.toList());
  }

  private static long nowEpochSeconds() {
    return Instant.now().getEpochSecond();
  }
}
