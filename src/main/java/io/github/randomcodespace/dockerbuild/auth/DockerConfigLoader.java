package io.github.randomcodespace.dockerbuild.auth;

import io.github.randomcodespace.dockerbuild.exceptions.AuthEncodingException;
import io.github.randomcodespace.dockerbuild.exceptions.ContainerBuildException;
import io.github.randomcodespace.dockerbuild.utils.JsonParserUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads registry credentials from the docker client configuration file. The file is looked up in
 * {@code $DOCKER_CONFIG}, falling back to {@code ~/.docker}.
 */
public class DockerConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(DockerConfigLoader.class);

  public static final String DOCKER_CONFIG_ENV = "DOCKER_CONFIG";
  public static final String CONFIG_FILE_NAME = "config.json";

  private final Path configFile;

  public DockerConfigLoader() {
    this(locate(System.getenv(), System.getProperty("user.home")));
  }

  public DockerConfigLoader(Path configFile) {
    this.configFile = configFile;
  }

  static Path locate(Map<String, String> environment, String userHome) {
    String configDir = environment.get(DOCKER_CONFIG_ENV);
    if (configDir != null && !configDir.isBlank()) {
      return Paths.get(configDir, CONFIG_FILE_NAME);
    }
    return Paths.get(userHome, ".docker", CONFIG_FILE_NAME);
  }

  public Path getConfigFile() {
    return configFile;
  }

  /**
   * Loads the {@code auths} section of the configuration file.
   *
   * @return the credentials found; empty when the file does not exist.
   * @throws ContainerBuildException if the file exists but cannot be read or parsed.
   * @throws AuthEncodingException if an {@code auth} field is not Base64 of {@code user:password}.
   */
  public AuthConfigSet load() {
    if (!Files.exists(configFile)) {
      logger.debug("No docker config file at {}; no registry credentials loaded.", configFile);
      return AuthConfigSet.empty();
    }

    DockerConfigFile config;
    try {
      config = JsonParserUtil.fromJson(configFile, DockerConfigFile.class);
    } catch (IOException e) {
      throw new ContainerBuildException(
          "Failed to read docker config file " + configFile + ": " + e.getMessage(), e);
    }

    AuthConfigSet authConfigs = AuthConfigSet.empty();
    if (config == null || config.getAuths() == null) {
      return authConfigs;
    }
    config
        .getAuths()
        .forEach((registry, entry) -> authConfigs.put(registry, toCredential(registry, entry)));
    logger.info("Loaded credentials for {} registries from {}", authConfigs.size(), configFile);
    return authConfigs;
  }

  private static RegistryCredential toCredential(
      String registry, DockerConfigFile.AuthEntry entry) {
    RegistryCredential.RegistryCredentialBuilder builder =
        RegistryCredential.builder().serverAddress(registry);
    if (entry == null) {
      return builder.build();
    }
    if (entry.getIdentityToken() != null) {
      return builder.identityToken(entry.getIdentityToken()).build();
    }
    builder.username(entry.getUsername()).password(entry.getPassword()).email(entry.getEmail());
    if (entry.getAuth() != null && !entry.getAuth().isEmpty()) {
      String[] userAndPassword = decodeAuth(registry, entry.getAuth());
      builder.username(userAndPassword[0]).password(userAndPassword[1]);
    }
    return builder.build();
  }

  static String[] decodeAuth(String registry, String auth) {
    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(auth.trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new AuthEncodingException("Invalid auth entry for registry " + registry, e);
    }
    int pos = decoded.indexOf(':');
    if (pos < 0) {
      throw new AuthEncodingException(
          "Auth entry for registry " + registry + " is not of the form username:password");
    }
    return new String[] {decoded.substring(0, pos), decoded.substring(pos + 1)};
  }
}
