package io.github.randomcodespace.dockerbuild.exceptions;

import java.nio.file.Path;

public class InvalidDockerfileSpecException extends ContainerBuildException {
  private final Path dockerfile;

  public InvalidDockerfileSpecException(String message, Path dockerfile) {
    super(message);
    this.dockerfile = dockerfile;
  }

  public InvalidDockerfileSpecException(String message, Path dockerfile, Throwable cause) {
    super(message, cause);
    this.dockerfile = dockerfile;
  }

  public Path getDockerfile() {
    return dockerfile;
  }
}
