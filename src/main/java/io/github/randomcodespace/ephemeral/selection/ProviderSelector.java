package io.github.randomcodespace.ephemeral.selection;

import io.github.randomcodespace.ephemeral.dto.ImageMapping;
import io.github.randomcodespace.ephemeral.exceptions.NoAvailableProviderException;
import io.github.randomcodespace.ephemeral.exceptions.UnknownImageTypeException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the candidate mapping used to satisfy a logical image type. Selection is a pure function of
 * its inputs, so routing decisions can be reproduced without any provider access.
 */
public final class ProviderSelector {
  private static final Logger logger = LoggerFactory.getLogger(ProviderSelector.class);

  private ProviderSelector() {}

  /**
   * Selects exactly one candidate whose provider is registered.
   *
   * <p>A preferred provider wins over priority when it has a candidate and is registered. Otherwise
   * the registered candidate with the lowest priority is chosen; ties keep their original order.
   *
   * @param imageType The logical image type, used for error context.
   * @param candidates Candidates for the image type, in routing-table order.
   * @param registeredProviders Names of the providers currently registered.
   * @param preferredProvider Optional caller preference, may be null.
   * @return The selected candidate.
   * @throws UnknownImageTypeException if there are no candidates at all.
   * @throws NoAvailableProviderException if no candidate references a registered provider.
   */
  public static ImageMapping select(
      String imageType,
      List<ImageMapping> candidates,
      Set<String> registeredProviders,
      String preferredProvider) {
    if (candidates == null || candidates.isEmpty()) {
      throw new UnknownImageTypeException(imageType);
    }

    if (preferredProvider != null) {
      Optional<ImageMapping> preferred =
          candidates.stream()
              .filter(mapping -> preferredProvider.equals(mapping.getProvider()))
              .findFirst();
      if (preferred.isPresent() && registeredProviders.contains(preferredProvider)) {
        logger.debug("Using preferred provider {} for image type {}", preferredProvider, imageType);
        return preferred.get();
      }
      if (preferred.isEmpty()) {
        logger.warn(
            "Preferred provider {} has no mapping for image type {}; falling back to priority.",
            preferredProvider,
            imageType);
      } else {
        logger.warn(
            "Preferred provider {} is not registered; falling back to priority for image type {}.",
            preferredProvider,
            imageType);
      }
    }

    // Stream.sorted is stable for ordered streams, so equal priorities keep list order.
    ImageMapping selected =
        candidates.stream()
            .filter(mapping -> registeredProviders.contains(mapping.getProvider()))
            .sorted(Comparator.comparingInt(ImageMapping::getPriority))
            .findFirst()
            .orElseThrow(() -> new NoAvailableProviderException(imageType));
    logger.debug(
        "Selected provider {} (priority {}) for image type {}",
        selected.getProvider(),
        selected.getPriority(),
        imageType);
    return selected;
  }
}
