package io.github.randomcodespace.ephemeral.exceptions;

/**
 * The instance was created but never reported ready within its attempt budget. The resource is
 * left in place; destroying it is up to the caller.
 */
public class ReadinessTimeoutException extends VmManagerException {
  private final String instanceId;
  private final int attempts;

  public ReadinessTimeoutException(String instanceId, int attempts) {
    super(
        "Instance "
            + instanceId
            + " failed to become ready within timeout ("
            + attempts
            + " attempts)");
    this.instanceId = instanceId;
    this.attempts = attempts;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public int getAttempts() {
    return attempts;
  }
}
