package io.github.randomcodespace.ephemeral.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for JSON handling of provider API payloads using Jackson. */
public class JsonParserUtil {
  private static final Logger logger = LoggerFactory.getLogger(JsonParserUtil.class);
  private static final ObjectMapper objectMapper = new ObjectMapper();

  static {
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private JsonParserUtil() {}

  /**
   * Parses a JSON document into a tree.
   *
   * @param jsonString The JSON string to parse.
   * @return An Optional containing the tree, or Optional.empty() if the input is blank or invalid.
   */
  public static Optional<JsonNode> readTree(String jsonString) {
    if (jsonString == null || jsonString.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readTree(jsonString));
    } catch (JsonProcessingException e) {
      logger.warn(
          "Failed to parse JSON document: {}. JSON: {}", e.getMessage(), overview(jsonString));
      return Optional.empty();
    }
  }

  /**
   * Serializes an object into a JSON string.
   *
   * @param object The object to serialize.
   * @return An Optional containing the JSON string, or Optional.empty() if serialization fails.
   */
  public static Optional<String> toJson(Object object) {
    if (object == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.writeValueAsString(object));
    } catch (JsonProcessingException e) {
      logger.warn(
          "Failed to serialize object to JSON: {}. Object: {}", e.getMessage(), object.toString());
      return Optional.empty();
    }
  }

  public static ObjectNode createObjectNode() {
    return objectMapper.createObjectNode();
  }

  /**
   * Returns the text at {@code field}, or an empty string when it is missing or null. Numeric ids
   * are rendered as their decimal text.
   */
  public static String text(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    return value == null || value.isNull() ? "" : value.asText();
  }

  private static String overview(String text) {
    if (text == null) return "null";
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
