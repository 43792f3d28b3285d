package io.github.randomcodespace.ephemeral.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** Uniform view of a provider's virtual machine. */
@Getter
@Builder
@ToString
@Jacksonized
public class Instance {
  public static final String STATUS_KEY = "status";

  private final String id; // Provider-assigned, opaque
  @Builder.Default private final String ip = ""; // Empty until an address is assigned

  @Builder.Default
  private final Map<String, Object> providerData = Collections.emptyMap(); // Diagnostics only

  /**
   * @return the provider's own status string, or null if the adapter did not report one.
   */
  @JsonIgnore
  public String getStatus() {
    Object status = providerData == null ? null : providerData.get(STATUS_KEY);
    return status == null ? null : status.toString();
  }

  public boolean hasAddress() {
    return ip != null && !ip.isBlank();
  }
}
