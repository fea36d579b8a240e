package io.github.randomcodespace.dockerbuild.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/** The parts of a docker client {@code config.json} that carry registry credentials. */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
class DockerConfigFile {
  private final Map<String, AuthEntry> auths;

  @Getter
  @Builder
  @Jacksonized
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class AuthEntry {
    private final String auth; // base64 of "username:password"
    private final String username;
    private final String password;
    private final String email;

    @JsonProperty("identitytoken")
    private final String identityToken;
  }
}
