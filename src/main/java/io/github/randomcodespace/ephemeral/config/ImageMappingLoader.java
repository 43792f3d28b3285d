package io.github.randomcodespace.ephemeral.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.randomcodespace.ephemeral.dto.ImageMapping;
import io.github.randomcodespace.ephemeral.exceptions.ImageMappingLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the routing table from YAML. The document maps each image type to an ordered list of
 * candidates:
 *
 * <pre>
 * ubuntu-22-small:
 *   - provider: hetzner
 *     image: ubuntu-22.04
 *     size: cx11
 *     priority: 1
 *     ttl: 3600
 * </pre>
 *
 * Any load failure is fatal and surfaces as {@link ImageMappingLoadException}.
 */
public class ImageMappingLoader {
  private static final Logger logger = LoggerFactory.getLogger(ImageMappingLoader.class);
  private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  static {
    yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private ImageMappingLoader() {}

  public static RoutingTable load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ImageMappingLoadException("Image mappings file not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.toString());
    } catch (IOException e) {
      throw new ImageMappingLoadException(
          "Failed to load image mappings from " + path + ": " + e.getMessage(), e);
    }
  }

  public static RoutingTable fromClasspath(String resource) {
    InputStream in = ImageMappingLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new ImageMappingLoadException("Image mappings resource not found: " + resource);
    }
    try (in) {
      return load(in, "classpath:" + resource);
    } catch (IOException e) {
      throw new ImageMappingLoadException(
          "Failed to load image mappings from classpath:" + resource + ": " + e.getMessage(), e);
    }
  }

  /**
   * Reads and validates a routing table.
   *
   * @param in The YAML document. Not closed by this method.
   * @param source A description of where the document came from, used in errors.
   * @return The loaded routing table.
   * @throws ImageMappingLoadException if the document is malformed or an entry is invalid.
   */
  public static RoutingTable load(InputStream in, String source) {
    Map<String, List<ImageMapping>> raw;
    try {
      raw =
          yamlMapper.readValue(
              in, new TypeReference<LinkedHashMap<String, List<ImageMapping>>>() {});
    } catch (IOException e) {
      throw new ImageMappingLoadException(
          "Failed to load image mappings from " + source + ": " + e.getMessage(), e);
    }
    if (raw == null) {
      throw new ImageMappingLoadException("Image mappings document is empty: " + source);
    }

    raw.forEach((imageType, candidates) -> validate(source, imageType, candidates));
    RoutingTable table = new RoutingTable(raw);
    logger.info("Loaded {} image type(s) from {}", table.getImageTypes().size(), source);
    return table;
  }

  private static void validate(String source, String imageType, List<ImageMapping> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      throw new ImageMappingLoadException(
          "Image type '" + imageType + "' in " + source + " has no mappings");
    }
    for (int i = 0; i < candidates.size(); i++) {
      ImageMapping mapping = candidates.get(i);
      String where = "'" + imageType + "'[" + i + "] in " + source;
      if (mapping == null) {
        throw new ImageMappingLoadException("Null mapping at " + where);
      }
      requireText(mapping.getProvider(), "provider", where);
      requireText(mapping.getImage(), "image", where);
      requireText(mapping.getSize(), "size", where);
      if (mapping.getPriority() == null) {
        throw new ImageMappingLoadException("Missing 'priority' at " + where);
      }
    }
  }

  private static void requireText(String value, String field, String where) {
    if (value == null || value.isBlank()) {
      throw new ImageMappingLoadException("Missing '" + field + "' at " + where);
    }
  }
}
