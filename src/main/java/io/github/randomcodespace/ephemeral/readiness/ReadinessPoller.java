package io.github.randomcodespace.ephemeral.readiness;

import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.exceptions.ReadinessTimeoutException;
import io.github.randomcodespace.ephemeral.exceptions.VmManagerException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.MaxRetriesExceededException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks until a freshly created instance is reachable. A resilience4j {@link Retry} calls the
 * provider's describe primitive at a constant interval until the ready predicate holds or the
 * attempt budget runs out.
 *
 * <p>A permanently broken provider and a slow one look the same here: both end in a {@link
 * ReadinessTimeoutException}. Errors thrown by the describe call itself are not retried.
 */
public class ReadinessPoller {
  private static final Logger logger = LoggerFactory.getLogger(ReadinessPoller.class);

  private final RetryRegistry retryRegistry;

  public ReadinessPoller() {
    this(RetryRegistry.ofDefaults());
  }

  /**
   * @param retryRegistry Registry the per-instance retries are created in. Its event publisher sees
   *     every poll, which is how callers observe the wait schedule.
   */
  public ReadinessPoller(RetryRegistry retryRegistry) {
    this.retryRegistry = retryRegistry;
  }

  /**
   * Polls {@code describeFn} until {@code readyPredicate} accepts a snapshot.
   *
   * @param instanceId The instance to describe.
   * @param describeFn The provider's describe primitive.
   * @param readyPredicate Decides whether a snapshot counts as ready.
   * @param policy Attempt budget and interval.
   * @param <T> The snapshot type.
   * @return The first snapshot that satisfied the predicate.
   * @throws ReadinessTimeoutException if {@code policy.getMaxAttempts()} snapshots were not ready.
   * @throws VmManagerException if the thread is interrupted while waiting.
   */
  public <T> T awaitReady(
      String instanceId,
      Function<String, T> describeFn,
      Predicate<? super T> readyPredicate,
      PollingPolicy policy) {
    RetryConfig config =
        RetryConfig.<T>custom()
            .maxAttempts(policy.getMaxAttempts())
            .intervalFunction(IntervalFunction.of(policy.getInterval()))
            .retryOnResult(snapshot -> !readyPredicate.test(snapshot))
            .retryOnException(e -> false)
            .failAfterMaxAttempts(true)
            .build();
    Retry retry = retryRegistry.retry("readiness-" + instanceId, config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                logger.debug(
                    "Instance {} not ready (attempt {}/{}), next check in {}",
                    instanceId,
                    event.getNumberOfRetryAttempts(),
                    policy.getMaxAttempts(),
                    event.getWaitInterval()));

    try {
      T snapshot = retry.executeSupplier(() -> describeFn.apply(instanceId));
      logger.debug("Instance {} ready.", instanceId);
      return snapshot;
    } catch (MaxRetriesExceededException e) {
      logger.warn(
          "Instance {} not ready after {} attempts; left for the caller to clean up.",
          instanceId,
          policy.getMaxAttempts());
      throw new ReadinessTimeoutException(instanceId, policy.getMaxAttempts());
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new VmManagerException("Readiness polling interrupted for instance " + instanceId, e);
      }
      throw e;
    } finally {
      retryRegistry.remove(retry.getName());
    }
  }

  /**
   * Builds the predicate every provider shares: the provider's own status string is one of {@code
   * readyStatuses} and a non-empty address is assigned.
   *
   * @param readyStatuses Status values meaning "running" in the provider's vocabulary.
   * @return The readiness predicate.
   */
  public static Predicate<Instance> statusWithAddress(String... readyStatuses) {
    Set<String> statuses = Arrays.stream(readyStatuses).collect(Collectors.toUnmodifiableSet());
    return instance ->
        instance != null
            && instance.getStatus() != null
            && statuses.contains(instance.getStatus())
            && instance.hasAddress();
  }
}
