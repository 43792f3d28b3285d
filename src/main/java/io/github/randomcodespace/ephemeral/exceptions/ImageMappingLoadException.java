package io.github.randomcodespace.ephemeral.exceptions;

public class ImageMappingLoadException extends VmManagerException {
  public ImageMappingLoadException(String message) {
    super(message);
  }

  public ImageMappingLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
