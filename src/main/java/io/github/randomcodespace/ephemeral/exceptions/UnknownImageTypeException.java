package io.github.randomcodespace.ephemeral.exceptions;

/** No routing entry exists for the requested logical image type. */
public class UnknownImageTypeException extends VmManagerException {
  private final String imageType;

  public UnknownImageTypeException(String imageType) {
    super("No image mappings found for image type: " + imageType);
    this.imageType = imageType;
  }

  public String getImageType() {
    return imageType;
  }
}
