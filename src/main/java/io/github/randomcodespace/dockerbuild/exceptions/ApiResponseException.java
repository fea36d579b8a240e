package io.github.randomcodespace.dockerbuild.exceptions;

public class ApiResponseException extends ContainerBuildException {
  private final int statusCode; // HTTP status code returned by the daemon

  public ApiResponseException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public ApiResponseException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  @Override
  public String getMessage() {
    return super.getMessage() + " (Status Code: " + statusCode + ")";
  }
}
