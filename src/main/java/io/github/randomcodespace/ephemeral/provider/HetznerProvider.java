package io.github.randomcodespace.ephemeral.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.randomcodespace.ephemeral.dto.HetznerConfig;
import io.github.randomcodespace.ephemeral.dto.ImageSpec;
import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.exceptions.ApiResponseException;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import io.github.randomcodespace.ephemeral.readiness.ReadinessPoller;
import io.github.randomcodespace.ephemeral.utils.JsonParserUtil;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hetzner Cloud servers through the Hetzner Cloud API v1. Servers are ready once their status is
 * {@code running} and a public IPv4 address is assigned.
 */
public class HetznerProvider extends AbstractRestProvider {
  private static final Logger logger = LoggerFactory.getLogger(HetznerProvider.class);

  public static final String NAME = "hetzner";

  private final String defaultLocation;

  public HetznerProvider(HetznerConfig config) {
    this(config, new ReadinessPoller());
  }

  public HetznerProvider(HetznerConfig config, ReadinessPoller poller) {
    super(config.getBaseUrl(), config.getApiToken(), config.getPollingPolicy(), poller);
    this.defaultLocation = config.getDefaultLocation();
  }

  @Override
  public String getProviderName() {
    return NAME;
  }

  @Override
  public CompletableFuture<Instance> createVm(
      ImageSpec spec, String sshPublicKey, String startupScript) {
    return runAsync(
        () -> {
          long sshKeyId = ensureSshKey(sshPublicKey);

          ObjectNode payload = JsonParserUtil.createObjectNode();
          payload.put("name", "playground-" + System.currentTimeMillis());
          payload.put("server_type", spec.getSize());
          payload.put("image", spec.getImage());
          payload.put("location", defaultLocation);
          payload.putArray("ssh_keys").add(sshKeyId);
          if (startupScript != null) {
            payload.put("user_data", startupScript);
          }
          payload.put("start_after_create", true);

          JsonNode server = sendRequest("POST", "/servers", payload).path("server");
          String serverId = JsonParserUtil.text(server, "id");
          if (serverId.isEmpty()) {
            throw new ProviderOperationFailedException(
                NAME, "Hetzner API returned no server id for " + spec);
          }
          logger.info(
              "Hetzner server {} requested ({} / {} in {}); waiting for it to become ready.",
              serverId,
              spec.getImage(),
              spec.getSize(),
              defaultLocation);
          return awaitReady(serverId);
        });
  }

  @Override
  protected Instance describe(String instanceId) {
    JsonNode server = sendRequest("GET", "/servers/" + instanceId, null).path("server");
    return toInstance(server);
  }

  @Override
  protected String deletePath(String instanceId) {
    return "/servers/" + instanceId;
  }

  @Override
  protected String[] readyStatuses() {
    return new String[] {"running"};
  }

  @Override
  protected String extractErrorMessage(JsonNode errorBody) {
    return JsonParserUtil.text(errorBody.path("error"), "message");
  }

  private long ensureSshKey(String publicKey) {
    return SshKeyReconciler.ensure(
        NAME,
        () -> {
          ObjectNode body = JsonParserUtil.createObjectNode();
          body.put("name", SshKeyReconciler.keyName(publicKey));
          body.put("public_key", publicKey);
          JsonNode keyId = sendRequest("POST", "/ssh_keys", body).path("ssh_key").path("id");
          if (!keyId.canConvertToLong()) {
            throw new ProviderOperationFailedException(NAME, "Hetzner API returned no SSH key id");
          }
          return keyId.asLong();
        },
        () -> findSshKey(publicKey),
        HetznerProvider::isUniquenessError);
  }

  private Optional<Long> findSshKey(String publicKey) {
    JsonNode keys = sendRequest("GET", "/ssh_keys", null).path("ssh_keys");
    return StreamSupport.stream(keys.spliterator(), false)
        .filter(key -> SshKeyReconciler.sameKey(JsonParserUtil.text(key, "public_key"), publicKey))
        .map(key -> key.path("id").asLong())
        .findFirst();
  }

  private static boolean isUniquenessError(ProviderOperationFailedException e) {
    return e instanceof ApiResponseException
        && ((ApiResponseException) e).getStatusCode() == 409;
  }

  private Instance toInstance(JsonNode server) {
    Map<String, Object> providerData = new LinkedHashMap<>();
    providerData.put("name", JsonParserUtil.text(server, "name"));
    providerData.put(Instance.STATUS_KEY, JsonParserUtil.text(server, "status"));
    providerData.put(
        "location", JsonParserUtil.text(server.path("datacenter").path("location"), "name"));
    return Instance.builder()
        .id(JsonParserUtil.text(server, "id"))
        .ip(JsonParserUtil.text(server.path("public_net").path("ipv4"), "ip"))
        .providerData(providerData)
        .build();
  }
}
