package io.github.randomcodespace.dockerbuild.context;

import io.github.randomcodespace.dockerbuild.exceptions.InvalidDockerfileSpecException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link ResolvedDockerfile} into the archive layout for a build. Only this step touches
 * the filesystem: a relocated Dockerfile must exist and be readable before packaging starts.
 */
public class DockerfileRelocator {
  private static final Logger logger = LoggerFactory.getLogger(DockerfileRelocator.class);

  /**
   * Builds the context spec for {@code contextDirectory}, adding the relocated Dockerfile as an
   * extra entry when the resolution requires it.
   *
   * @throws InvalidDockerfileSpecException if the relocation source is not a readable file.
   */
  public BuildContextSpec relocateInto(Path contextDirectory, ResolvedDockerfile resolved) {
    BuildContextSpec.BuildContextSpecBuilder builder =
        BuildContextSpec.builder().contextDirectory(contextDirectory);
    if (!resolved.isRelocated()) {
      return builder.build();
    }

    String placeholder = resolved.getContextRelativePath().orElseThrow();
    String sourceText = resolved.getRelocationSourcePath().orElseThrow();
    Path source;
    try {
      source = Paths.get(sourceText);
    } catch (InvalidPathException e) {
      throw new InvalidDockerfileSpecException(
          "Dockerfile path is not valid on this platform: " + sourceText, null, e);
    }
    if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
      throw new InvalidDockerfileSpecException(
          "Dockerfile outside the build context cannot be read: " + source, source);
    }
    logger.info("Copying Dockerfile {} into build context as {}", source, placeholder);
    return builder.extraEntry(placeholder, source).build();
  }
}
