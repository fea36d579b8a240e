package io.github.randomcodespace.dockerbuild.exceptions;

public class ContainerBuildException extends RuntimeException {
  public ContainerBuildException(String message) {
    super(message);
  }

  public ContainerBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
