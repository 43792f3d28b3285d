package io.github.randomcodespace.ephemeral.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Provider-native image and size identifiers handed to a provider's create call. */
@Getter
@Builder
@ToString
public class ImageSpec {
  private final String image; // e.g. "ubuntu-22.04" (Hetzner), "ubuntu-22-04-x64" (DigitalOcean)
  private final String size; // e.g. "cx11", "s-1vcpu-1gb"
}
