package io.github.randomcodespace.ephemeral.exceptions;

/** Root of every error raised by the VM orchestration layer. */
public class VmManagerException extends RuntimeException {
  public VmManagerException(String message) {
    super(message);
  }

  public VmManagerException(String message, Throwable cause) {
    super(message, cause);
  }
}
