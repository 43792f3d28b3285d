package io.github.randomcodespace.ephemeral.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * An {@link Instance} returned from the creation path, extended with the metadata callers need to
 * track and expire it themselves. Nothing in this library keeps a reference to it.
 */
@Getter
@Builder
@ToString(exclude = "sshKey")
@Jacksonized
public class ManagedInstance {
  private final String id;
  private final String ip;
  private final Map<String, Object> providerData;
  private final String provider;
  private final String imageType;
  private final long createdAt; // Epoch seconds
  private final long ttl; // Seconds
  private final String sshKey;

  public static ManagedInstance from(
      Instance instance,
      String provider,
      String imageType,
      long createdAt,
      long ttl,
      String sshKey) {
    return ManagedInstance.builder()
        .id(instance.getId())
        .ip(instance.getIp())
        .providerData(instance.getProviderData())
        .provider(provider)
        .imageType(imageType)
        .createdAt(createdAt)
        .ttl(ttl)
        .sshKey(sshKey)
        .build();
  }

  /**
   * @return the instant, in epoch seconds, from which this record counts as expired.
   */
  @JsonIgnore
  public long getExpiresAt() {
    return createdAt + ttl;
  }
}
