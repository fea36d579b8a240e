package io.github.randomcodespace.dockerbuild.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;

/** Utility class for JSON handling using Jackson. Map entries are written in insertion order. */
public class JsonParserUtil {
  private static final ObjectMapper objectMapper = new ObjectMapper();

  static {
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private JsonParserUtil() {}

  /**
   * Serializes an object into a compact JSON string.
   *
   * @param object The object to serialize.
   * @return The JSON text.
   * @throws JsonProcessingException if Jackson cannot serialize the object.
   */
  public static String toJson(Object object) throws JsonProcessingException {
    return objectMapper.writeValueAsString(object);
  }

  /**
   * Parses a JSON string into an object of the specified generic type.
   *
   * @param jsonString The JSON string to parse.
   * @param typeReference The TypeReference for the generic type.
   * @param <T> The type of the object.
   * @return The parsed object, null for a JSON {@code null} literal.
   * @throws JsonProcessingException if the text is not valid JSON for the type.
   */
  public static <T> T fromJson(String jsonString, TypeReference<T> typeReference)
      throws JsonProcessingException {
    return objectMapper.readValue(jsonString, typeReference);
  }

  /**
   * Reads a JSON file into an object of the specified class.
   *
   * @throws IOException if the file cannot be read or does not hold valid JSON.
   */
  public static <T> T fromJson(Path file, Class<T> valueType) throws IOException {
    return objectMapper.readValue(file.toFile(), valueType);
  }

  /** Shortens text for log output. */
  public static String overview(String text) {
    if (text == null) return "null";
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
