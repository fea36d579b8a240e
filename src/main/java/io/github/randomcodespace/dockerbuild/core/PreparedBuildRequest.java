package io.github.randomcodespace.dockerbuild.core;

import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A build request ready for the transport: query parameters, headers and the context archive. */
@Getter
@Builder
@ToString
public class PreparedBuildRequest {
  public static final String BUILD_ENDPOINT = "/build";

  private final Map<String, List<String>> parameters; // in insertion order, values repeatable
  @ToString.Exclude private final Map<String, String> headers;
  @ToString.Exclude private final InputStream body; // null for remote builds

  public Optional<InputStream> getBody() {
    return Optional.ofNullable(body);
  }

  /** First value of a query parameter, if it was set. */
  public Optional<String> getParameter(String name) {
    List<String> values = parameters.get(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  /** Endpoint path with the URL-encoded query string. */
  public String toRequestPath() {
    String query =
        parameters.entrySet().stream()
            .flatMap(e -> e.getValue().stream().map(v -> encode(e.getKey()) + "=" + encode(v)))
            .collect(Collectors.joining("&"));
    return query.isEmpty() ? BUILD_ENDPOINT : BUILD_ENDPOINT + "?" + query;
  }

  private static String encode(String text) {
    return URLEncoder.encode(text, StandardCharsets.UTF_8);
  }
}
