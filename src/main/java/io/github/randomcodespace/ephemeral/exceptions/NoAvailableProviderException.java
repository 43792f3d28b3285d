package io.github.randomcodespace.ephemeral.exceptions;

/** Routing entries exist for the image type, but none names a registered provider. */
public class NoAvailableProviderException extends VmManagerException {
  private final String imageType;

  public NoAvailableProviderException(String imageType) {
    super("No available providers for image type: " + imageType);
    this.imageType = imageType;
  }

  public String getImageType() {
    return imageType;
  }
}
