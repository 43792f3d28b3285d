package io.github.randomcodespace.ephemeral.exceptions;

public class ApiResponseException extends ProviderOperationFailedException {
  private final int statusCode; // HTTP status code returned by the provider API

  public ApiResponseException(String providerName, String message, int statusCode) {
    super(providerName, message);
    this.statusCode = statusCode;
  }

  public ApiResponseException(
      String providerName, String message, int statusCode, Throwable cause) {
    super(providerName, message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return statusCode == 404;
  }

  @Override
  public String getMessage() {
    return super.getMessage() + " (Status Code: " + statusCode + ")";
  }
}
