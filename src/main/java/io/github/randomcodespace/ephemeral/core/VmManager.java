package io.github.randomcodespace.ephemeral.core;

import io.github.randomcodespace.ephemeral.dto.ImageSpec;
import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import io.github.randomcodespace.ephemeral.exceptions.ReadinessTimeoutException;
import java.util.concurrent.CompletableFuture;

public interface VmManager {

  /**
   * Creates a virtual machine and waits until it is reachable.
   *
   * @param spec Provider-native image and size.
   * @param sshPublicKey Public SSH key (OpenSSH format) authorized on the machine.
   * @param startupScript Optional cloud-init / user data script, may be null.
   * @return A CompletableFuture holding the ready instance, with a non-empty id and address.
   * @throws ProviderOperationFailedException if the provider rejects or fails the request.
   * @throws ReadinessTimeoutException if the machine never becomes ready. The machine is not
   *     destroyed.
   */
  CompletableFuture<Instance> createVm(ImageSpec spec, String sshPublicKey, String startupScript);

  /**
   * Destroys a virtual machine. Destroying one that no longer exists succeeds.
   *
   * @param instanceId The provider-specific instance id.
   * @return A CompletableFuture that completes when the provider accepted the deletion.
   * @throws ProviderOperationFailedException if deletion fails.
   */
  CompletableFuture<Void> destroyVm(String instanceId);

  /**
   * Describes a virtual machine's current state.
   *
   * @param instanceId The provider-specific instance id.
   * @return A CompletableFuture holding the current instance view.
   * @throws ProviderOperationFailedException if the instance does not exist or cannot be queried.
   */
  CompletableFuture<Instance> getVm(String instanceId);
}
