package io.github.randomcodespace.ephemeral.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Arguments for creating an ephemeral instance. */
@Getter
@Builder
@ToString(exclude = "sshKey")
public class CreateInstanceRequest {
  private final String imageType; // Key into the routing table, e.g. "ubuntu-22-small"
  private final String sshKey; // OpenSSH public key
  private final String startupScript; // Optional cloud-init / user data
  private final String preferredProvider; // Optional; wins over priority when registered
}
