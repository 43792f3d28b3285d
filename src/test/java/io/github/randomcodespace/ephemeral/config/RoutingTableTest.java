package io.github.randomcodespace.ephemeral.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.randomcodespace.ephemeral.dto.ImageMapping;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class RoutingTableTest {

  private static ImageMapping mapping(String provider, Integer priority) {
    return ImageMapping.builder()
        .provider(provider)
        .image("ubuntu-22.04")
        .size("small")
        .priority(priority)
        .build();
  }

  @Test
  void testCandidateWithoutPriorityIsRejected() {
    Map<String, List<ImageMapping>> mappings =
        Map.of("ubuntu", List.of(mapping("p1", 1), mapping("p2", null)));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> new RoutingTable(mappings));
    assertTrue(e.getMessage().contains("ubuntu"));
  }

  @Test
  void testNullCandidateIsRejected() {
    List<ImageMapping> candidates = new ArrayList<>();
    candidates.add(mapping("p1", 1));
    candidates.add(null);

    assertThrows(
        IllegalArgumentException.class, () -> new RoutingTable(Map.of("ubuntu", candidates)));
  }

  @Test
  void testTableIsAnOrderedSnapshot() {
    Map<String, List<ImageMapping>> mappings = new LinkedHashMap<>();
    List<ImageMapping> ubuntu = new ArrayList<>(List.of(mapping("p1", 1)));
    mappings.put("ubuntu", ubuntu);
    mappings.put("debian", List.of(mapping("p2", 1)));

    RoutingTable table = new RoutingTable(mappings);
    ubuntu.add(mapping("p3", 2));

    assertEquals(List.of("ubuntu", "debian"), List.copyOf(table.getImageTypes()));
    assertEquals(1, table.getMappings("ubuntu").size());
    assertTrue(table.contains("debian"));
    assertTrue(table.getMappings("alpine").isEmpty());
    assertThrows(
        UnsupportedOperationException.class, () -> table.getMappings("ubuntu").add(null));
  }
}
