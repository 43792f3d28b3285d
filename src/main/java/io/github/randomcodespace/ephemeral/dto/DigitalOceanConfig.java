package io.github.randomcodespace.ephemeral.dto;

import io.github.randomcodespace.ephemeral.readiness.PollingPolicy;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Settings for the DigitalOcean provider. */
@Getter
@Builder
@ToString(exclude = "apiToken")
public class DigitalOceanConfig {
  private final String apiToken;
  @Builder.Default private final String defaultRegion = "nyc3";
  @Builder.Default private final String baseUrl = "https://api.digitalocean.com/v2";

  @Builder.Default
  private final PollingPolicy pollingPolicy = PollingPolicy.of(30, Duration.ofSeconds(3));
}
