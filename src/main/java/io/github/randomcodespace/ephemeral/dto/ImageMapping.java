package io.github.randomcodespace.ephemeral.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * One routing-table entry: a provider-specific way to satisfy a logical image type. Lower priority
 * values are preferred.
 */
@Getter
@Builder
@ToString
@Jacksonized
public class ImageMapping {
  public static final int DEFAULT_TTL_SECONDS = 3600;

  private final String provider;
  private final String image;
  private final String size;
  private final Integer priority;
  private final Integer ttl; // Seconds; optional, zero or negative means unset

  /**
   * @return the configured TTL, or {@link #DEFAULT_TTL_SECONDS} when none (or a non-positive one)
   *     was given.
   */
  @JsonIgnore
  public int getEffectiveTtl() {
    return ttl != null && ttl > 0 ? ttl : DEFAULT_TTL_SECONDS;
  }

  public ImageSpec toImageSpec() {
    return ImageSpec.builder().image(image).size(size).build();
  }
}
