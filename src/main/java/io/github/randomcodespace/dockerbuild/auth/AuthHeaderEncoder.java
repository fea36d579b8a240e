package io.github.randomcodespace.dockerbuild.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.github.randomcodespace.dockerbuild.exceptions.AuthEncodingException;
import io.github.randomcodespace.dockerbuild.utils.JsonParserUtil;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes registry credentials into the {@value #REGISTRY_CONFIG_HEADER} header of a build request.
 *
 * <p>The value is the JSON object of all credentials keyed by registry, encoded with URL-safe
 * Base64, which keeps it ASCII and free of line breaks. The encoder holds no state.
 */
public class AuthHeaderEncoder {
  private static final Logger logger = LoggerFactory.getLogger(AuthHeaderEncoder.class);

  public static final String REGISTRY_CONFIG_HEADER = "X-Registry-Config";

  private static final TypeReference<LinkedHashMap<String, Object>> RAW_CONFIG_TYPE =
      new TypeReference<>() {};

  /**
   * Encodes the credentials into a header value.
   *
   * @throws AuthEncodingException if the credentials cannot be serialized.
   */
  public String encode(AuthConfigSet authConfigs) {
    if (authConfigs == null) {
      throw new AuthEncodingException("Cannot encode a null registry config");
    }
    String json;
    try {
      json = JsonParserUtil.toJson(authConfigs.asMap());
    } catch (JsonProcessingException e) {
      throw new AuthEncodingException(
          "Failed to serialize registry config for " + authConfigs.registries(), e);
    }
    return Base64.getUrlEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Recovers the credentials from a header value produced by {@link #encode(AuthConfigSet)}.
   *
   * @throws AuthEncodingException if the value is not valid Base64 or does not hold a registry
   *     config object.
   */
  public AuthConfigSet decode(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      throw new AuthEncodingException("Registry config header value is empty");
    }
    byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(headerValue.trim());
    } catch (IllegalArgumentException e) {
      throw new AuthEncodingException("Registry config header is not URL-safe Base64", e);
    }
    Map<String, Object> raw;
    try {
      raw = JsonParserUtil.fromJson(new String(json, StandardCharsets.UTF_8), RAW_CONFIG_TYPE);
    } catch (JsonProcessingException e) {
      throw new AuthEncodingException("Registry config header does not hold a JSON object", e);
    }
    if (raw == null) {
      throw new AuthEncodingException("Registry config header holds a JSON null");
    }
    return AuthConfigSet.fromRaw(raw);
  }

  /**
   * Adds the registry config header to {@code headers}. Other entries are left alone; an existing
   * registry config header is replaced. Nothing is changed when there are no credentials or when
   * encoding fails.
   *
   * @param headers Mutable header map of the outgoing request.
   * @param authConfigs Credentials to send, may be null.
   * @return {@code headers}, for chaining.
   * @throws AuthEncodingException if the credentials cannot be encoded.
   */
  public Map<String, String> attach(Map<String, String> headers, AuthConfigSet authConfigs) {
    if (authConfigs == null || authConfigs.isEmpty()) {
      logger.debug("No registry credentials configured; {} not sent.", REGISTRY_CONFIG_HEADER);
      return headers;
    }
    String encoded = encode(authConfigs);
    headers.put(REGISTRY_CONFIG_HEADER, encoded);
    logger.debug(
        "Attached {} with credentials for registries {}",
        REGISTRY_CONFIG_HEADER,
        authConfigs.registries());
    return headers;
  }
}
