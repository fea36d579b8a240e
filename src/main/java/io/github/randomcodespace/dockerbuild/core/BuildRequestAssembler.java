package io.github.randomcodespace.dockerbuild.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.randomcodespace.dockerbuild.auth.AuthConfigSet;
import io.github.randomcodespace.dockerbuild.auth.AuthHeaderEncoder;
import io.github.randomcodespace.dockerbuild.context.BuildContextArchiver;
import io.github.randomcodespace.dockerbuild.context.BuildContextSpec;
import io.github.randomcodespace.dockerbuild.context.DockerfileRelocator;
import io.github.randomcodespace.dockerbuild.context.PathResolver;
import io.github.randomcodespace.dockerbuild.context.ResolvedDockerfile;
import io.github.randomcodespace.dockerbuild.dto.ImageBuildConfig;
import io.github.randomcodespace.dockerbuild.exceptions.ContainerBuildException;
import io.github.randomcodespace.dockerbuild.utils.JsonParserUtil;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares an image build request: resolves the Dockerfile, relocates it into the context when it
 * lives outside, packages the context and finally attaches the registry credentials. Every step
 * runs before any network I/O, so a failure leaves nothing half-sent.
 */
public class BuildRequestAssembler {
  private static final Logger logger = LoggerFactory.getLogger(BuildRequestAssembler.class);

  public static final String CONTENT_TYPE_HEADER = "Content-Type";
  public static final String TAR_CONTENT_TYPE = "application/x-tar";

  private final PathResolver pathResolver;
  private final DockerfileRelocator relocator;
  private final BuildContextArchiver archiver;
  private final AuthHeaderEncoder authHeaderEncoder;

  public BuildRequestAssembler(BuildContextArchiver archiver) {
    this(new PathResolver(), new DockerfileRelocator(), archiver, new AuthHeaderEncoder());
  }

  public BuildRequestAssembler(
      PathResolver pathResolver,
      DockerfileRelocator relocator,
      BuildContextArchiver archiver,
      AuthHeaderEncoder authHeaderEncoder) {
    this.pathResolver = pathResolver;
    this.relocator = relocator;
    this.archiver = archiver;
    this.authHeaderEncoder = authHeaderEncoder;
  }

  /**
   * Assembles the request for {@code config}.
   *
   * @param config Build options.
   * @param authConfigs Registry credentials to forward to the daemon, may be null.
   * @return the prepared request; its body (if any) must be consumed or closed by the caller.
   * @throws ContainerBuildException if the context is ambiguous or cannot be packaged.
   */
  public PreparedBuildRequest assemble(ImageBuildConfig config, AuthConfigSet authConfigs) {
    boolean hasContext = config.getContextDirectory() != null;
    boolean hasRemote = config.getRemote() != null && !config.getRemote().isBlank();
    if (hasContext == hasRemote) {
      throw new ContainerBuildException(
          "Exactly one of a context directory or a remote context must be given.");
    }

    Map<String, String> headers = new LinkedHashMap<>();
    String dockerfileParam;
    InputStream body = null;
    if (hasRemote) {
      // the daemon resolves the Dockerfile inside the remote context itself
      dockerfileParam = config.getDockerfile();
    } else {
      Path contextDirectory = config.getContextDirectory().toAbsolutePath();
      ResolvedDockerfile resolved =
          pathResolver.resolve(config.getDockerfile(), contextDirectory.toString());
      BuildContextSpec contextSpec = relocator.relocateInto(contextDirectory, resolved);
      dockerfileParam = resolved.getContextRelativePath().orElse(null);
      try {
        body = archiver.archive(contextSpec);
      } catch (IOException e) {
        throw new ContainerBuildException(
            "Failed to package build context " + contextDirectory + ": " + e.getMessage(), e);
      }
      headers.put(CONTENT_TYPE_HEADER, TAR_CONTENT_TYPE);
    }

    try {
      authHeaderEncoder.attach(headers, authConfigs);
    } catch (RuntimeException e) {
      closeQuietly(body, e);
      throw e;
    }

    Map<String, List<String>> parameters = buildParameters(config, dockerfileParam);
    logger.debug("Prepared build request with parameters {}", parameters);
    return PreparedBuildRequest.builder()
        .parameters(parameters)
        .headers(headers)
        .body(body)
        .build();
  }

  private Map<String, List<String>> buildParameters(ImageBuildConfig config, String dockerfile) {
    Map<String, List<String>> parameters = new LinkedHashMap<>();
    if (!config.getTags().isEmpty()) {
      parameters.put("t", new ArrayList<>(config.getTags()));
    }
    put(parameters, "q", String.valueOf(config.isQuiet()));
    if (dockerfile != null) {
      put(parameters, "dockerfile", dockerfile);
    }
    put(parameters, "rm", String.valueOf(config.isRemoveIntermediateContainers()));
    put(parameters, "nocache", String.valueOf(config.isNoCache()));
    put(parameters, "pull", String.valueOf(config.isPullParent()));
    put(parameters, "forcerm", String.valueOf(config.isForceRemoveIntermediateContainers()));
    if (config.getRemote() != null && !config.getRemote().isBlank()) {
      put(parameters, "remote", config.getRemote());
    }
    if (!config.getBuildArgs().isEmpty()) {
      put(parameters, "buildargs", toJsonParameter("buildargs", config.getBuildArgs()));
    }
    if (!config.getLabels().isEmpty()) {
      put(parameters, "labels", toJsonParameter("labels", config.getLabels()));
    }
    return parameters;
  }

  private static void put(Map<String, List<String>> parameters, String name, String value) {
    parameters.put(name, List.of(value));
  }

  private static String toJsonParameter(String name, Map<String, String> value) {
    try {
      return JsonParserUtil.toJson(value);
    } catch (JsonProcessingException e) {
      throw new ContainerBuildException("Failed to serialize build parameter " + name, e);
    }
  }

  private static void closeQuietly(InputStream body, RuntimeException failure) {
    if (body == null) {
      return;
    }
    try {
      body.close();
    } catch (IOException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }
}
