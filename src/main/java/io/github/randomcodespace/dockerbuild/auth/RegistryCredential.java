package io.github.randomcodespace.dockerbuild.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Credentials for one registry, in the shape the daemon reads from the registry config header.
 * Absent fields are left out of the JSON.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistryCredential {
  @JsonProperty("username")
  private final String username;

  @ToString.Exclude
  @JsonProperty("password")
  private final String password;

  @JsonProperty("email")
  private final String email;

  @JsonProperty("serveraddress")
  private final String serverAddress;

  @ToString.Exclude
  @JsonProperty("identitytoken")
  private final String identityToken;
}
