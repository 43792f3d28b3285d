package io.github.randomcodespace.ephemeral.provider;

import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure an SSH public key is registered with a provider account before a VM references it.
 * The key is created first; when the provider reports that it already exists, the existing entry
 * is looked up instead of surfacing the conflict. This is a reconciliation step, not a retry: the
 * create call is never repeated.
 */
public final class SshKeyReconciler {
  private static final Logger logger = LoggerFactory.getLogger(SshKeyReconciler.class);

  private static final String KEY_NAME_PREFIX = "playground-key-";

  private SshKeyReconciler() {}

  /**
   * @param providerName Provider name for logs and errors.
   * @param create Registers the key and returns the provider's reference to it.
   * @param lookup Finds the already registered key, if any.
   * @param alreadyExists Recognizes the provider's "already exists" failure.
   * @param <K> The provider's key reference type (numeric id, fingerprint, ...).
   * @return The reference to the registered key.
   * @throws ProviderOperationFailedException if creation fails for another reason, or the
   *     conflicting key cannot be found.
   */
  public static <K> K ensure(
      String providerName,
      Supplier<K> create,
      Supplier<Optional<K>> lookup,
      Predicate<ProviderOperationFailedException> alreadyExists) {
    try {
      K created = create.get();
      logger.info("Registered SSH key with {}", providerName);
      return created;
    } catch (ProviderOperationFailedException e) {
      if (!alreadyExists.test(e)) {
        throw e;
      }
      logger.warn("SSH key already registered with {}; looking up existing entry.", providerName);
      return lookup
          .get()
          .orElseThrow(
              () ->
                  new ProviderOperationFailedException(
                      providerName, "Failed to create or find SSH key in " + providerName, e));
    }
  }

  /**
   * @return a stable key name derived from the key material.
   */
  public static String keyName(String publicKey) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(publicKey.trim().getBytes(StandardCharsets.UTF_8));
      return KEY_NAME_PREFIX + HexFormat.of().formatHex(hash).substring(0, 8);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** Compares two OpenSSH public keys, ignoring surrounding whitespace. */
  public static boolean sameKey(String a, String b) {
    return a != null && b != null && a.trim().equals(b.trim());
  }
}
