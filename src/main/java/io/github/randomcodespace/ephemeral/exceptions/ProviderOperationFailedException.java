package io.github.randomcodespace.ephemeral.exceptions;

/**
 * A call into a provider's control plane failed (authentication, quota, validation, network). The
 * original failure, when there is one, is kept as the cause.
 */
public class ProviderOperationFailedException extends VmManagerException {
  private final String providerName;

  public ProviderOperationFailedException(String providerName, String message) {
    super(message);
    this.providerName = providerName;
  }

  public ProviderOperationFailedException(String providerName, String message, Throwable cause) {
    super(message, cause);
    this.providerName = providerName;
  }

  public String getProviderName() {
    return providerName;
  }
}
