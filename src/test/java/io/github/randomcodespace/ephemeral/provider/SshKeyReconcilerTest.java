package io.github.randomcodespace.ephemeral.provider;

import static org.junit.jupiter.api.Assertions.*;

import io.github.randomcodespace.ephemeral.exceptions.ApiResponseException;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

public class SshKeyReconcilerTest {

  private static final Predicate<ProviderOperationFailedException> CONFLICT =
      e -> e instanceof ApiResponseException && ((ApiResponseException) e).getStatusCode() == 409;

  @Test
  void testCreatedKeyIsReturnedWithoutLookup() {
    AtomicInteger lookups = new AtomicInteger();

    Long id =
        SshKeyReconciler.ensure(
            "hetzner",
            () -> 42L,
            () -> {
              lookups.incrementAndGet();
              return Optional.empty();
            },
            CONFLICT);

    assertEquals(42L, id);
    assertEquals(0, lookups.get());
  }

  @Test
  void testConflictFallsBackToLookup() {
    AtomicInteger creates = new AtomicInteger();

    Long id =
        SshKeyReconciler.ensure(
            "hetzner",
            () -> {
              creates.incrementAndGet();
              throw new ApiResponseException("hetzner", "not unique", 409);
            },
            () -> Optional.of(7L),
            CONFLICT);

    assertEquals(7L, id);
    assertEquals(1, creates.get());
  }

  @Test
  void testConflictWithoutExistingKeyFails() {
    ProviderOperationFailedException e =
        assertThrows(
            ProviderOperationFailedException.class,
            () ->
                SshKeyReconciler.ensure(
                    "hetzner",
                    () -> {
                      throw new ApiResponseException("hetzner", "not unique", 409);
                    },
                    Optional::empty,
                    CONFLICT));

    assertEquals("Failed to create or find SSH key in hetzner", e.getMessage());
    assertInstanceOf(ApiResponseException.class, e.getCause());
  }

  @Test
  void testOtherFailuresPropagateUnchanged() {
    ApiResponseException unauthorized = new ApiResponseException("hetzner", "unauthorized", 401);

    ApiResponseException e =
        assertThrows(
            ApiResponseException.class,
            () ->
                SshKeyReconciler.ensure(
                    "hetzner",
                    () -> {
                      throw unauthorized;
                    },
                    () -> Optional.of(1L),
                    CONFLICT));

    assertSame(unauthorized, e);
  }

  @Test
  void testKeyNameIsStableAndIgnoresSurroundingWhitespace() {
    String key = "ssh-ed25519 AAAAC3NzaC1lZDI1NTE5AAAAIK0 user@host";

    String name = SshKeyReconciler.keyName(key);

    assertTrue(name.matches("playground-key-[0-9a-f]{8}"), name);
    assertEquals(name, SshKeyReconciler.keyName("  " + key + "\n"));
    assertNotEquals(name, SshKeyReconciler.keyName("ssh-rsa AAAAB3NzaC1yc2E other@host"));
  }

  @Test
  void testSameKey() {
    assertTrue(SshKeyReconciler.sameKey("ssh-ed25519 AAAA a@b\n", "ssh-ed25519 AAAA a@b"));
    assertFalse(SshKeyReconciler.sameKey("ssh-ed25519 AAAA a@b", "ssh-ed25519 BBBB a@b"));
    assertFalse(SshKeyReconciler.sameKey(null, "ssh-ed25519 AAAA a@b"));
  }
}
