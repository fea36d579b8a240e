package io.github.randomcodespace.dockerbuild.context;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of resolving a Dockerfile against a build context. The context-relative path is what the
 * daemon receives as its {@code dockerfile} build parameter; the relocation source, when present,
 * names a file outside the context that has to be copied into the archive under that path.
 */
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolvedDockerfile {
  private static final ResolvedDockerfile NONE = new ResolvedDockerfile(null, null);

  private final String contextRelativePath;
  private final String relocationSourcePath;

  /** No Dockerfile override was requested; the daemon applies its default discovery. */
  public static ResolvedDockerfile none() {
    return NONE;
  }

  public static ResolvedDockerfile inContext(String contextRelativePath) {
    return new ResolvedDockerfile(contextRelativePath, null);
  }

  public static ResolvedDockerfile relocated(String placeholderPath, String relocationSourcePath) {
    return new ResolvedDockerfile(placeholderPath, relocationSourcePath);
  }

  public Optional<String> getContextRelativePath() {
    return Optional.ofNullable(contextRelativePath);
  }

  public Optional<String> getRelocationSourcePath() {
    return Optional.ofNullable(relocationSourcePath);
  }

  public boolean isRelocated() {
    return relocationSourcePath != null;
  }
}
