package io.github.randomcodespace.ephemeral.core;

import io.github.randomcodespace.ephemeral.config.ImageMappingLoader;
import io.github.randomcodespace.ephemeral.config.RoutingTable;
import io.github.randomcodespace.ephemeral.dto.CreateInstanceRequest;
import io.github.randomcodespace.ephemeral.dto.ImageMapping;
import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.dto.ManagedInstance;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import io.github.randomcodespace.ephemeral.exceptions.ProviderUnavailableException;
import io.github.randomcodespace.ephemeral.exceptions.UnknownImageTypeException;
import io.github.randomcodespace.ephemeral.exceptions.VmManagerException;
import io.github.randomcodespace.ephemeral.selection.ProviderSelector;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless entry point for creating, querying and destroying ephemeral VMs across providers. It
 * resolves a logical image type to a provider through the routing table, delegates the VM call to
 * that provider, and returns the result without recording it anywhere. Tracking, expiry and
 * cleanup of created instances belong to the caller.
 *
 * <p>The provider registry and routing table are fixed at construction, so one service may be used
 * from many threads at once.
 */
public class EphemeralVmService implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(EphemeralVmService.class);

  private final Map<String, VmManager> providers;
  private final RoutingTable routingTable;
  private final Clock clock;

  /**
   * Constructs the service, loading the routing table from a YAML file.
   *
   * @param providers Provider handles keyed by the names used in the routing table.
   * @param imageMappingsPath Path to the routing table.
   * @throws io.github.randomcodespace.ephemeral.exceptions.ImageMappingLoadException if the table
   *     cannot be loaded.
   */
  public EphemeralVmService(Map<String, ? extends VmManager> providers, Path imageMappingsPath) {
    this(providers, ImageMappingLoader.load(imageMappingsPath));
  }

  public EphemeralVmService(Map<String, ? extends VmManager> providers, RoutingTable routingTable) {
    this(providers, routingTable, Clock.systemUTC());
  }

  public EphemeralVmService(
      Map<String, ? extends VmManager> providers, RoutingTable routingTable, Clock clock) {
    this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
    this.clock = Objects.requireNonNull(clock, "clock");
    logger.info(
        "EphemeralVmService initialized with providers {} and {} image type(s).",
        this.providers.keySet(),
        routingTable.getImageTypes().size());
  }

  /**
   * Creates an instance of the requested image type on the selected provider and waits for it to
   * become reachable.
   *
   * @param request The image type, SSH key, optional startup script and optional preference.
   * @return A CompletableFuture holding the ready instance with its creation metadata. It fails
   *     with the provider's error, or with a {@link
   *     io.github.randomcodespace.ephemeral.exceptions.ReadinessTimeoutException} when the machine
   *     exists but never became ready; the caller must destroy it.
   * @throws UnknownImageTypeException if the image type has no mappings. No provider is called.
   * @throws io.github.randomcodespace.ephemeral.exceptions.NoAvailableProviderException if none of
   *     the mapped providers is registered.
   */
  public CompletableFuture<ManagedInstance> createInstance(CreateInstanceRequest request) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(request.getSshKey(), "sshKey");
    String imageType = request.getImageType();
    List<ImageMapping> mappings = routingTable.getMappings(imageType);
    if (mappings.isEmpty()) {
      throw new UnknownImageTypeException(imageType);
    }

    ImageMapping selected =
        ProviderSelector.select(
            imageType, mappings, providers.keySet(), request.getPreferredProvider());
    String providerName = selected.getProvider();
    VmManager provider = resolveProvider(providerName);

    logger.info(
        "Creating {} instance on {} (image {}, size {}).",
        imageType,
        providerName,
        selected.getImage(),
        selected.getSize());
    return invoke(
            providerName,
            "create instance for image type '" + imageType + "'",
            () ->
                provider.createVm(
                    selected.toImageSpec(), request.getSshKey(), request.getStartupScript()))
        .thenApply(
            instance -> {
              if (instance == null || instance.getId() == null || instance.getId().isBlank()) {
                throw new ProviderOperationFailedException(
                    providerName, "Provider '" + providerName + "' returned no instance id");
              }
              ManagedInstance created =
                  ManagedInstance.from(
                      instance,
                      providerName,
                      imageType,
                      clock.instant().getEpochSecond(),
                      selected.getEffectiveTtl(),
                      request.getSshKey());
              logger.info(
                  "Instance {} ready on {} at {} (ttl {}s).",
                  created.getId(),
                  providerName,
                  created.getIp(),
                  created.getTtl());
              return created;
            });
  }

  /**
   * Destroys an instance. Instances that no longer exist are treated as destroyed.
   *
   * @throws ProviderUnavailableException if {@code providerName} is not registered.
   */
  public CompletableFuture<Void> destroyInstance(String providerName, String instanceId) {
    VmManager provider = resolveProvider(providerName);
    logger.info("Destroying instance {} on {}.", instanceId, providerName);
    return invoke(
        providerName, "destroy instance " + instanceId, () -> provider.destroyVm(instanceId));
  }

  /**
   * Describes an instance's current state.
   *
   * @throws ProviderUnavailableException if {@code providerName} is not registered.
   */
  public CompletableFuture<Instance> getInstance(String providerName, String instanceId) {
    VmManager provider = resolveProvider(providerName);
    return invoke(providerName, "get instance " + instanceId, () -> provider.getVm(instanceId));
  }

  public List<String> getAvailableImageTypes() {
    return List.copyOf(routingTable.getImageTypes());
  }

  public List<String> getAvailableProviders() {
    return List.copyOf(providers.keySet());
  }

  /**
   * @return the candidate mappings for {@code imageType}, or an empty list if it is unknown.
   */
  public List<ImageMapping> getImageMappings(String imageType) {
    return routingTable.getMappings(imageType);
  }

  private VmManager resolveProvider(String providerName) {
    VmManager provider = providerName == null ? null : providers.get(providerName);
    if (provider == null) {
      throw new ProviderUnavailableException(providerName);
    }
    return provider;
  }

  /**
   * Runs a provider call, attaching provider context to any failure that is not already one of
   * this library's exceptions.
   */
  private <T> CompletableFuture<T> invoke(
      String providerName, String operation, Supplier<CompletableFuture<T>> call) {
    CompletableFuture<T> future;
    try {
      future = call.get();
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future.handle(
        (result, error) -> {
          if (error == null) {
            return result;
          }
          throw toVmManagerException(providerName, operation, error);
        });
  }

  private static VmManagerException toVmManagerException(
      String providerName, String operation, Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
    if (cause instanceof VmManagerException) {
      logger.error("Failed to {} on {}: {}", operation, providerName, cause.getMessage());
      return (VmManagerException) cause;
    }
    logger.error("Failed to {} on {}.", operation, providerName, cause);
    return new ProviderOperationFailedException(
        providerName,
        "Provider '" + providerName + "' failed to " + operation + ": " + cause.getMessage(),
        cause);
  }

  /**
   * Closes every registered provider that holds resources. All providers are attempted; the first
   * failure is rethrown afterwards.
   *
   * @throws IOException if closing a provider fails.
   */
  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (Map.Entry<String, VmManager> entry : providers.entrySet()) {
      if (entry.getValue() instanceof Closeable) {
        try {
          ((Closeable) entry.getValue()).close();
        } catch (IOException e) {
          logger.warn("Error closing provider {}", entry.getKey(), e);
          if (failure == null) {
            failure = e;
          }
        }
      }
    }
    logger.info("EphemeralVmService closed and resources released.");
    if (failure != null) {
      throw failure;
    }
  }
}
