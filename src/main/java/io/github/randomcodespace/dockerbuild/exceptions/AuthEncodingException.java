package io.github.randomcodespace.dockerbuild.exceptions;

/**
 * Raised when registry credentials cannot be turned into (or recovered from) the registry config
 * header value. The build request is aborted before anything is sent to the daemon.
 */
public class AuthEncodingException extends ContainerBuildException {
  public AuthEncodingException(String message) {
    super(message);
  }

  public AuthEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
