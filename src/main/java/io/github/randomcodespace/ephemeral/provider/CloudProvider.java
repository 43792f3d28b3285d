package io.github.randomcodespace.ephemeral.provider;

import io.github.randomcodespace.ephemeral.core.VmManager;

public interface CloudProvider extends VmManager {
  /** Short name used in logs and error context, e.g. "hetzner". */
  String getProviderName();
}
