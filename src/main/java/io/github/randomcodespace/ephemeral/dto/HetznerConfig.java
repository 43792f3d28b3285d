package io.github.randomcodespace.ephemeral.dto;

import io.github.randomcodespace.ephemeral.readiness.PollingPolicy;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Settings for the Hetzner Cloud provider. */
@Getter
@Builder
@ToString(exclude = "apiToken")
public class HetznerConfig {
  private final String apiToken;
  @Builder.Default private final String defaultLocation = "nbg1";
  @Builder.Default private final String baseUrl = "https://api.hetzner.cloud/v1";

  @Builder.Default
  private final PollingPolicy pollingPolicy = PollingPolicy.of(30, Duration.ofSeconds(2));
}
