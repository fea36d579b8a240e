package io.github.randomcodespace.dockerbuild.context;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a user-supplied Dockerfile location against a build context root.
 *
 * <p>Resolution is lexical: path strings are split into segments and {@code .}/{@code ..} are
 * collapsed without consulting the filesystem, so symlinks are never followed. A Dockerfile whose
 * net position lies inside the context is returned as a context-relative path. One that lies
 * outside is mapped to a placeholder name under the context root and reported as a relocation, and
 * the context builder copies it into the archive under that name.
 *
 * <p>Instances are immutable and safe to share between concurrent builds.
 */
public class PathResolver {
  private static final Logger logger = LoggerFactory.getLogger(PathResolver.class);

  /** Prefix of the name a relocated Dockerfile is archived under. */
  public static final String RELOCATED_DOCKERFILE_PREFIX = ".dockerfile.";

  private final boolean windowsPaths;

  /** Creates a resolver matching the host platform. */
  public PathResolver() {
    this(isWindowsHost());
  }

  /**
   * @param windowsPaths enables drive-letter handling, case-insensitive segment comparison and
   *     stripping of the {@code \\?\} long-path prefix.
   */
  public PathResolver(boolean windowsPaths) {
    this.windowsPaths = windowsPaths;
  }

  /**
   * Resolves {@code dockerfileSpec} against {@code contextRoot}.
   *
   * @param dockerfileSpec Dockerfile location, relative to the context root or absolute. {@code
   *     null} means no override; an empty string is an explicit (empty) name.
   * @param contextRoot Build context directory. A relative root is anchored at the process working
   *     directory.
   * @return the resolved Dockerfile; never null.
   */
  public ResolvedDockerfile resolve(String dockerfileSpec, String contextRoot) {
    if (contextRoot == null) {
      throw new IllegalArgumentException("Build context root must not be null.");
    }
    if (dockerfileSpec == null) {
      return ResolvedDockerfile.none();
    }

    LexicalPath root = absoluteRoot(contextRoot);
    LexicalPath spec = LexicalPath.parse(dockerfileSpec, windowsPaths);
    LexicalPath dockerfile = root.resolve(spec);
    List<String> relative = root.relativize(dockerfile);

    if (LexicalPath.escapes(relative)) {
      String source = dockerfile.toString();
      String placeholder = placeholderFor(source);
      logger.debug(
          "Dockerfile {} lies outside build context {}; relocating as {}",
          source,
          root,
          placeholder);
      return ResolvedDockerfile.relocated(placeholder, source);
    }

    if (spec.isAbsolute()) {
      String inContext = relative.isEmpty() ? "." : String.join("/", relative);
      return ResolvedDockerfile.inContext(inContext);
    }
    // relative specs keep their own spelling, "../baz/Dockerfile" from base/baz included
    return ResolvedDockerfile.inContext(dockerfileSpec.replace('\\', '/'));
  }

  /**
   * Name a relocated Dockerfile gets inside the context. Derived from the source path so the same
   * source always maps to the same entry.
   */
  static String placeholderFor(String sourcePath) {
    try {
      MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
      byte[] digest = sha1.digest(sourcePath.getBytes(StandardCharsets.UTF_8));
      return RELOCATED_DOCKERFILE_PREFIX + HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      // SHA-1 is a mandatory JCA algorithm
      throw new IllegalStateException("SHA-1 digest unavailable", e);
    }
  }

  private LexicalPath absoluteRoot(String contextRoot) {
    LexicalPath root = LexicalPath.parse(contextRoot, windowsPaths);
    if (root.isAbsolute()) {
      return root;
    }
    LexicalPath workingDir = LexicalPath.parse(System.getProperty("user.dir"), windowsPaths);
    return workingDir.resolve(root);
  }

  private static boolean isWindowsHost() {
    return System.getProperty("os.name", "").toLowerCase().contains("win");
  }
}
