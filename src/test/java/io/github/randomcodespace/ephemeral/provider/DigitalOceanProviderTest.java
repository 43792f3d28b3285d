package io.github.randomcodespace.ephemeral.provider;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.randomcodespace.ephemeral.dto.DigitalOceanConfig;
import io.github.randomcodespace.ephemeral.dto.ImageSpec;
import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.exceptions.ApiResponseException;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import io.github.randomcodespace.ephemeral.exceptions.VmManagerException;
import io.github.randomcodespace.ephemeral.readiness.PollingPolicy;
import io.github.randomcodespace.ephemeral.utils.JsonParserUtil;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DigitalOceanProviderTest {

  private static final String SSH_KEY = "ssh-ed25519 AAAAC3NzaC1lZDI1NTE5AAAAIH test@example";
  private static final ImageSpec SPEC =
      ImageSpec.builder().image("ubuntu-22-04-x64").size("s-1vcpu-1gb").build();

  private static final String NO_NETWORKS = "{\"v4\":[],\"v6\":[]}";
  private static final String PUBLIC_AND_PRIVATE =
      "{\"v4\":[{\"ip_address\":\"10.116.0.2\",\"type\":\"private\"},"
          + "{\"ip_address\":\"104.131.186.241\",\"type\":\"public\"}],\"v6\":[]}";

  private ScriptedApi api;
  private TestableDigitalOceanProvider provider;

  @BeforeEach
  void setUp() {
    api = new ScriptedApi();
    DigitalOceanConfig config =
        DigitalOceanConfig.builder()
            .apiToken("token")
            .pollingPolicy(PollingPolicy.of(30, Duration.ofMillis(1)))
            .build();
    provider = new TestableDigitalOceanProvider(config, api);
  }

  @AfterEach
  void tearDown() throws IOException {
    provider.close();
  }

  private static String droplet(long id, String status, String networks) {
    return "{\"droplet\":{\"id\":"
        + id
        + ",\"name\":\"playground-1\",\"status\":\""
        + status
        + "\",\"networks\":"
        + networks
        + ",\"region\":{\"slug\":\"nyc3\",\"name\":\"New York 3\"}}}";
  }

  @Test
  void testCreateVmWaitsUntilActiveWithPublicAddress() throws Exception {
    // Setup
    api.respond(
            "POST",
            "/account/keys",
            201,
            "{\"ssh_key\":{\"id\":512190,\"fingerprint\":\"3b:16:bf:e4\"}}")
        .respond("POST", "/droplets", 202, droplet(3164494, "new", NO_NETWORKS))
        .respond("GET", "/droplets/3164494", 200, droplet(3164494, "new", NO_NETWORKS))
        .respond("GET", "/droplets/3164494", 200, droplet(3164494, "active", NO_NETWORKS))
        .respond("GET", "/droplets/3164494", 200, droplet(3164494, "active", PUBLIC_AND_PRIVATE));

    // Execute
    Instance instance = provider.createVm(SPEC, SSH_KEY, "#!/bin/sh\n").get();

    // Verify
    assertEquals("3164494", instance.getId());
    assertEquals("104.131.186.241", instance.getIp());
    assertEquals("active", instance.getStatus());
    assertEquals("nyc3", instance.getProviderData().get("region"));
    assertEquals(3, api.getRequests("GET", "/droplets/3164494").size());

    JsonNode create =
        JsonParserUtil.readTree(api.getRequests("POST", "/droplets").get(0).body()).orElseThrow();
    assertEquals("nyc3", create.path("region").asText());
    assertEquals("s-1vcpu-1gb", create.path("size").asText());
    assertEquals("ubuntu-22-04-x64", create.path("image").asText());
    assertEquals("3b:16:bf:e4", create.path("ssh_keys").get(0).asText());
    assertEquals("#!/bin/sh\n", create.path("user_data").asText());
    assertFalse(create.path("monitoring").asBoolean());
    assertFalse(create.path("ipv6").asBoolean());
    assertEquals("playground", create.path("tags").get(0).asText());
    assertEquals("ephemeral", create.path("tags").get(1).asText());
  }

  @Test
  void testCreateVmReusesKeyAlreadyInUse() throws Exception {
    // Setup
    api.respond(
            "POST",
            "/account/keys",
            422,
            "{\"id\":\"unprocessable_entity\","
                + "\"message\":\"SSH Key is already in use on your account\"}")
        .respond(
            "GET",
            "/account/keys?per_page=200",
            200,
            "{\"ssh_keys\":[{\"id\":1,\"fingerprint\":\"aa:bb\",\"public_key\":\""
                + SSH_KEY
                + "\"}]}")
        .respond("POST", "/droplets", 202, droplet(77, "new", NO_NETWORKS))
        .respond("GET", "/droplets/77", 200, droplet(77, "active", PUBLIC_AND_PRIVATE));

    // Execute
    Instance instance = provider.createVm(SPEC, SSH_KEY, null).get();

    // Verify
    assertEquals("104.131.186.241", instance.getIp());
    JsonNode create =
        JsonParserUtil.readTree(api.getRequests("POST", "/droplets").get(0).body()).orElseThrow();
    assertEquals("aa:bb", create.path("ssh_keys").get(0).asText());
    assertFalse(create.has("user_data"));
  }

  @Test
  void testCreateVmSurfacesApiErrorMessage() {
    api.respond("POST", "/account/keys", 201, "{\"ssh_key\":{\"fingerprint\":\"aa:bb\"}}")
        .respond(
            "POST",
            "/droplets",
            422,
            "{\"id\":\"unprocessable_entity\",\"message\":\"You specified an invalid size\"}");

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> provider.createVm(SPEC, SSH_KEY, null).get());

    ApiResponseException cause = assertInstanceOf(ApiResponseException.class, e.getCause());
    assertEquals(422, cause.getStatusCode());
    assertEquals("digitalocean", cause.getProviderName());
    assertTrue(cause.getMessage().contains("You specified an invalid size"));
  }

  @Test
  void testCreateVmFailsWhenKeyResponseHasNoFingerprint() {
    api.respond("POST", "/account/keys", 201, "{\"ssh_key\":{\"id\":512190}}");

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> provider.createVm(SPEC, SSH_KEY, null).get());

    ProviderOperationFailedException cause =
        assertInstanceOf(ProviderOperationFailedException.class, e.getCause());
    assertFalse(cause instanceof ApiResponseException);
    assertTrue(api.getRequests("POST", "/droplets").isEmpty());
  }

  @Test
  void testUnauthorizedKeyRegistrationIsNotReconciled() {
    api.respond(
        "POST",
        "/account/keys",
        401,
        "{\"id\":\"unauthorized\",\"message\":\"Unable to authenticate you\"}");

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> provider.createVm(SPEC, SSH_KEY, null).get());

    assertEquals(401, assertInstanceOf(ApiResponseException.class, e.getCause()).getStatusCode());
    assertTrue(api.getRequests("GET", "/account/keys?per_page=200").isEmpty());
  }

  @Test
  void testGetVmWithoutPublicNetworkHasNoAddress() throws Exception {
    api.respond("GET", "/droplets/9", 200, droplet(9, "new", NO_NETWORKS));

    Instance instance = provider.getVm("9").get();

    assertEquals("9", instance.getId());
    assertEquals("", instance.getIp());
    assertFalse(instance.hasAddress());
  }

  @Test
  void testDestroyMissingDropletSucceeds() throws Exception {
    api.respond(
        "DELETE",
        "/droplets/10",
        404,
        "{\"id\":\"not_found\",\"message\":\"The resource could not be found.\"}");

    assertDoesNotThrow(() -> provider.destroyVm("10").get());
    assertEquals(1, api.getRequests("DELETE", "/droplets/10").size());
  }

  @Test
  void testDestroyVmWithEmptyResponse() throws Exception {
    api.respond("DELETE", "/droplets/11", 204, "");

    assertDoesNotThrow(() -> provider.destroyVm("11").get());
  }

  @Test
  void testBlankTokenIsRejected() {
    DigitalOceanConfig config = DigitalOceanConfig.builder().apiToken(null).build();

    assertThrows(VmManagerException.class, () -> new DigitalOceanProvider(config));
  }

  @Test
  void testDefaults() throws IOException {
    try (DigitalOceanProvider defaults =
        new DigitalOceanProvider(DigitalOceanConfig.builder().apiToken("token").build())) {
      assertEquals("digitalocean", defaults.getProviderName());
      assertEquals(30, defaults.getPollingPolicy().getMaxAttempts());
      assertEquals(Duration.ofSeconds(3), defaults.getPollingPolicy().getInterval());
    }
  }
}
