package io.github.randomcodespace.dockerbuild.auth;

import io.github.randomcodespace.dockerbuild.exceptions.AuthEncodingException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Registry credentials for one build request, keyed by registry address in the order they were
 * added. Keys are kept as given; adding a key twice keeps the last credential.
 */
@EqualsAndHashCode
@ToString
public final class AuthConfigSet {
  /** Key the Docker Hub credentials are stored under by the docker CLI. */
  public static final String INDEX_SERVER = "https://index.docker.io/v1/";

  private static final Set<String> HUB_ALIASES =
      Set.of("docker.io", "index.docker.io", "registry-1.docker.io", "registry.hub.docker.com");

  private final Map<String, RegistryCredential> credentials = new LinkedHashMap<>();

  public static AuthConfigSet empty() {
    return new AuthConfigSet();
  }

  public static AuthConfigSet of(Map<String, RegistryCredential> credentials) {
    AuthConfigSet set = new AuthConfigSet();
    credentials.forEach(set::put);
    return set;
  }

  /**
   * Builds a set from loosely typed data such as a parsed JSON object. Each value must be an
   * object whose known credential fields are strings (or null); unknown fields are ignored.
   *
   * @throws AuthEncodingException if an entry or a credential field has the wrong type.
   */
  public static AuthConfigSet fromRaw(Map<String, ?> raw) {
    AuthConfigSet set = new AuthConfigSet();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      if (!(entry.getValue() instanceof Map)) {
        throw new AuthEncodingException(
            "Credentials for registry '" + entry.getKey() + "' must be an object");
      }
      Map<?, ?> fields = (Map<?, ?>) entry.getValue();
      String registry = entry.getKey();
      set.put(
          registry,
          RegistryCredential.builder()
              .username(stringField(registry, fields, "username"))
              .password(stringField(registry, fields, "password"))
              .email(stringField(registry, fields, "email"))
              .serverAddress(stringField(registry, fields, "serveraddress"))
              .identityToken(stringField(registry, fields, "identitytoken"))
              .build());
    }
    return set;
  }

  private static String stringField(String registry, Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new AuthEncodingException(
        "Credential field '"
            + name
            + "' for registry '"
            + registry
            + "' must be a string but was "
            + value.getClass().getSimpleName());
  }

  public AuthConfigSet put(String registry, RegistryCredential credential) {
    if (registry == null) {
      throw new AuthEncodingException("Registry key must not be null");
    }
    if (credential == null) {
      throw new AuthEncodingException("Credential for registry '" + registry + "' is null");
    }
    credentials.put(registry, credential);
    return this;
  }

  public Optional<RegistryCredential> get(String registry) {
    return Optional.ofNullable(credentials.get(registry));
  }

  /**
   * Finds the credential for a registry regardless of how its key was spelled: scheme, path and
   * case are ignored and Docker Hub aliases all map to {@link #INDEX_SERVER}. A null or blank
   * registry means Docker Hub.
   */
  public Optional<RegistryCredential> resolve(String registry) {
    String target = registry == null || registry.isBlank() ? INDEX_SERVER : registry;
    RegistryCredential exact = credentials.get(target);
    if (exact != null) {
      return Optional.of(exact);
    }
    String wanted = normalizeRegistry(target);
    return credentials.entrySet().stream()
        .filter(e -> normalizeRegistry(e.getKey()).equals(wanted))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  static String normalizeRegistry(String key) {
    String host = key.trim().toLowerCase(Locale.ROOT);
    int scheme = host.indexOf("://");
    if (scheme >= 0) {
      host = host.substring(scheme + 3);
    }
    int slash = host.indexOf('/');
    if (slash >= 0) {
      host = host.substring(0, slash);
    }
    return HUB_ALIASES.contains(host) ? "index.docker.io" : host;
  }

  public boolean isEmpty() {
    return credentials.isEmpty();
  }

  public int size() {
    return credentials.size();
  }

  public Set<String> registries() {
    return Collections.unmodifiableSet(credentials.keySet());
  }

  /** Read-only view in insertion order; this is what goes on the wire. */
  public Map<String, RegistryCredential> asMap() {
    return Collections.unmodifiableMap(credentials);
  }
}
