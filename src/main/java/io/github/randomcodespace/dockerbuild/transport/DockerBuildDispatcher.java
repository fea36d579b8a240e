package io.github.randomcodespace.dockerbuild.transport;

import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.github.randomcodespace.dockerbuild.core.PreparedBuildRequest;
import io.github.randomcodespace.dockerbuild.exceptions.ApiResponseException;
import io.github.randomcodespace.dockerbuild.exceptions.ContainerBuildException;
import io.github.randomcodespace.dockerbuild.utils.JsonParserUtil;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends prepared build requests to the daemon over docker-java's HTTP transport and hands the raw
 * progress lines to a consumer. Decoding those lines is left to the caller.
 */
public class DockerBuildDispatcher implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(DockerBuildDispatcher.class);

  private final DockerHttpClient httpClient;

  public DockerBuildDispatcher(DockerHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  /**
   * Creates a dispatcher for the daemon described by the default docker-java configuration
   * ({@code DOCKER_HOST}, {@code DOCKER_TLS_VERIFY}, {@code DOCKER_CERT_PATH}).
   */
  public static DockerBuildDispatcher forDefaultDaemon() {
    DockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder().build();
    DockerHttpClient client =
        new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .build();
    logger.info("Build dispatcher targeting Docker daemon at {}.", config.getDockerHost());
    return new DockerBuildDispatcher(client);
  }

  /**
   * Posts the build request and streams the daemon's response lines.
   *
   * @param request The prepared request.
   * @param outputConsumer Receives each non-empty response line, may be null.
   * @throws ApiResponseException if the daemon rejects the request.
   * @throws ContainerBuildException if the exchange fails at the I/O level.
   */
  public void dispatch(PreparedBuildRequest request, Consumer<String> outputConsumer) {
    DockerHttpClient.Request.Builder builder =
        DockerHttpClient.Request.builder()
            .method(DockerHttpClient.Request.Method.POST)
            .path(request.toRequestPath())
            .headers(request.getHeaders());
    request.getBody().ifPresent(builder::body);
    DockerHttpClient.Request httpRequest = builder.build();

    logger.debug("POST {}", httpRequest.path());
    try (DockerHttpClient.Response response = httpClient.execute(httpRequest)) {
      int statusCode = response.getStatusCode();
      if (statusCode < 200 || statusCode >= 300) {
        String message = readFully(response.getBody());
        logger.error(
            "Docker daemon rejected build request with status {}: {}",
            statusCode,
            JsonParserUtil.overview(message));
        throw new ApiResponseException("Build request failed: " + message.trim(), statusCode);
      }
      streamLines(response.getBody(), outputConsumer);
    } catch (IOException e) {
      logger.error("I/O error while sending build request: {}", e.getMessage(), e);
      throw new ContainerBuildException("Failed to send build request: " + e.getMessage(), e);
    }
  }

  private static void streamLines(InputStream body, Consumer<String> outputConsumer)
      throws IOException {
    if (body == null) {
      return;
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        logger.trace("Build output: {}", line);
        if (outputConsumer != null) {
          outputConsumer.accept(line);
        }
      }
    }
  }

  private static String readFully(InputStream body) throws IOException {
    if (body == null) {
      return "";
    }
    try (body) {
      return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }
}
