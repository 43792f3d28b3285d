package io.github.randomcodespace.ephemeral.exceptions;

public class ProviderUnavailableException extends VmManagerException {
  private final String providerName;

  public ProviderUnavailableException(String providerName) {
    super("Provider '" + providerName + "' not available");
    this.providerName = providerName;
  }

  public String getProviderName() {
    return providerName;
  }
}
