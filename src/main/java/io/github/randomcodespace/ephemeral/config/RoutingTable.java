package io.github.randomcodespace.ephemeral.config;

import io.github.randomcodespace.ephemeral.dto.ImageMapping;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map from logical image type to its candidate mappings, in the order they were
 * declared. Safe to share between threads.
 */
public final class RoutingTable {
  private final Map<String, List<ImageMapping>> mappings;

  /**
   * @throws IllegalArgumentException if a candidate is null or has no priority.
   */
  public RoutingTable(Map<String, List<ImageMapping>> mappings) {
    Map<String, List<ImageMapping>> copy = new LinkedHashMap<>();
    mappings.forEach(
        (imageType, candidates) -> {
          for (ImageMapping candidate : candidates) {
            if (candidate == null || candidate.getPriority() == null) {
              throw new IllegalArgumentException(
                  "Candidate without a priority for image type '" + imageType + "': " + candidate);
            }
          }
          copy.put(imageType, List.copyOf(candidates));
        });
    this.mappings = Collections.unmodifiableMap(copy);
  }

  public Set<String> getImageTypes() {
    return mappings.keySet();
  }

  /**
   * @return the candidates for {@code imageType}, or an empty list if it is unknown.
   */
  public List<ImageMapping> getMappings(String imageType) {
    return mappings.getOrDefault(imageType, List.of());
  }

  public boolean contains(String imageType) {
    return !getMappings(imageType).isEmpty();
  }

  @Override
  public String toString() {
    return "RoutingTable" + mappings;
  }
}
