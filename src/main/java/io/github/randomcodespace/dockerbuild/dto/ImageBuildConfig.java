package io.github.randomcodespace.dockerbuild.dto;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Configuration for building an image. Exactly one of {@code contextDirectory} and {@code remote}
 * names the build context.
 */
@Getter
@Builder
@ToString
public class ImageBuildConfig {
  private final Path contextDirectory; // local build context, packaged and uploaded
  private final String remote; // git URL or tarball URL the daemon fetches itself

  // Dockerfile location, relative to the context or absolute; null for the daemon default
  private final String dockerfile;

  @Singular("tag")
  private final List<String> tags; // e.g. "myapp:latest"

  @Singular("buildArg")
  private final Map<String, String> buildArgs;

  @Singular("label")
  private final Map<String, String> labels;

  private final boolean quiet;
  private final boolean noCache;
  private final boolean pullParent; // always attempt to pull a newer base image
  private final boolean removeIntermediateContainers;
  private final boolean forceRemoveIntermediateContainers;
}
