package io.github.randomcodespace.ephemeral.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.randomcodespace.ephemeral.dto.DigitalOceanConfig;
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
 * DigitalOcean Droplets through the DigitalOcean API v2. Droplets are ready once their status is
 * {@code active} and a public IPv4 network is attached.
 */
public class DigitalOceanProvider extends AbstractRestProvider {
  private static final Logger logger = LoggerFactory.getLogger(DigitalOceanProvider.class);

  public static final String NAME = "digitalocean";

  private final String defaultRegion;

  public DigitalOceanProvider(DigitalOceanConfig config) {
    this(config, new ReadinessPoller());
  }

  public DigitalOceanProvider(DigitalOceanConfig config, ReadinessPoller poller) {
    super(config.getBaseUrl(), config.getApiToken(), config.getPollingPolicy(), poller);
    this.defaultRegion = config.getDefaultRegion();
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
          String fingerprint = ensureSshKey(sshPublicKey);

          ObjectNode payload = JsonParserUtil.createObjectNode();
          payload.put("name", "playground-" + System.currentTimeMillis());
          payload.put("region", defaultRegion);
          payload.put("size", spec.getSize());
          payload.put("image", spec.getImage());
          payload.putArray("ssh_keys").add(fingerprint);
          if (startupScript != null) {
            payload.put("user_data", startupScript);
          }
          payload.put("monitoring", false);
          payload.put("ipv6", false);
          payload.putArray("tags").add("playground").add("ephemeral");

          JsonNode droplet = sendRequest("POST", "/droplets", payload).path("droplet");
          String dropletId = JsonParserUtil.text(droplet, "id");
          if (dropletId.isEmpty()) {
            throw new ProviderOperationFailedException(
                NAME, "DigitalOcean API returned no droplet id for " + spec);
          }
          logger.info(
              "Droplet {} requested ({} / {} in {}); waiting for it to become ready.",
              dropletId,
              spec.getImage(),
              spec.getSize(),
              defaultRegion);
          return awaitReady(dropletId);
        });
  }

  @Override
  protected Instance describe(String instanceId) {
    JsonNode droplet = sendRequest("GET", "/droplets/" + instanceId, null).path("droplet");
    return toInstance(droplet);
  }

  @Override
  protected String deletePath(String instanceId) {
    return "/droplets/" + instanceId;
  }

  @Override
  protected String[] readyStatuses() {
    return new String[] {"active"};
  }

  @Override
  protected String extractErrorMessage(JsonNode errorBody) {
    return JsonParserUtil.text(errorBody, "message");
  }

  private String ensureSshKey(String publicKey) {
    return SshKeyReconciler.ensure(
        NAME,
        () -> {
          ObjectNode body = JsonParserUtil.createObjectNode();
          body.put("name", SshKeyReconciler.keyName(publicKey));
          body.put("public_key", publicKey);
          String fingerprint =
              JsonParserUtil.text(
                  sendRequest("POST", "/account/keys", body).path("ssh_key"), "fingerprint");
          if (fingerprint.isEmpty()) {
            throw new ProviderOperationFailedException(
                NAME, "DigitalOcean API returned no SSH key fingerprint");
          }
          return fingerprint;
        },
        () -> findSshKey(publicKey),
        DigitalOceanProvider::isKeyInUse);
  }

  private Optional<String> findSshKey(String publicKey) {
    JsonNode keys = sendRequest("GET", "/account/keys?per_page=200", null).path("ssh_keys");
    return StreamSupport.stream(keys.spliterator(), false)
        .filter(key -> SshKeyReconciler.sameKey(JsonParserUtil.text(key, "public_key"), publicKey))
        .map(key -> JsonParserUtil.text(key, "fingerprint"))
        .findFirst();
  }

  // DigitalOcean answers 422 "SSH Key is already in use on your account" for duplicates.
  private static boolean isKeyInUse(ProviderOperationFailedException e) {
    return e instanceof ApiResponseException
        && ((ApiResponseException) e).getStatusCode() == 422;
  }

  private Instance toInstance(JsonNode droplet) {
    String publicIp =
        StreamSupport.stream(droplet.path("networks").path("v4").spliterator(), false)
            .filter(network -> "public".equals(JsonParserUtil.text(network, "type")))
            .map(network -> JsonParserUtil.text(network, "ip_address"))
            .findFirst()
            .orElse("");

    Map<String, Object> providerData = new LinkedHashMap<>();
    providerData.put("name", JsonParserUtil.text(droplet, "name"));
    providerData.put(Instance.STATUS_KEY, JsonParserUtil.text(droplet, "status"));
    providerData.put("region", JsonParserUtil.text(droplet.path("region"), "slug"));
    return Instance.builder()
        .id(JsonParserUtil.text(droplet, "id"))
        .ip(publicIp)
        .providerData(providerData)
        .build();
  }
}
