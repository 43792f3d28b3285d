package io.github.randomcodespace.ephemeral.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.randomcodespace.ephemeral.dto.Instance;
import io.github.randomcodespace.ephemeral.exceptions.ApiResponseException;
import io.github.randomcodespace.ephemeral.exceptions.ProviderOperationFailedException;
import io.github.randomcodespace.ephemeral.exceptions.VmManagerException;
import io.github.randomcodespace.ephemeral.readiness.PollingPolicy;
import io.github.randomcodespace.ephemeral.readiness.ReadinessPoller;
import io.github.randomcodespace.ephemeral.utils.HttpExecutor;
import io.github.randomcodespace.ephemeral.utils.JsonParserUtil;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for providers whose control plane is a bearer-token JSON REST API. Provides request
 * execution, error mapping and the readiness wait shared by those adapters.
 */
public abstract class AbstractRestProvider implements CloudProvider, Closeable {
  private static final Logger logger = LoggerFactory.getLogger(AbstractRestProvider.class);

  // Readiness waits block for minutes; keep them off the common fork-join pool.
  private static final ExecutorService providerExecutor =
      Executors.newCachedThreadPool(
          runnable -> {
            Thread thread = new Thread(runnable, "vm-provider-worker");
            thread.setDaemon(true);
            return thread;
          });

  protected final String baseUrl;
  private final String apiToken;
  private final PollingPolicy pollingPolicy;
  private final ReadinessPoller readinessPoller;
  private final CloseableHttpClient httpClient;

  protected AbstractRestProvider(
      String baseUrl, String apiToken, PollingPolicy pollingPolicy, ReadinessPoller poller) {
    if (apiToken == null || apiToken.isBlank()) {
      throw new VmManagerException("An API token is required for " + getClass().getSimpleName());
    }
    this.baseUrl = baseUrl;
    this.apiToken = apiToken;
    this.pollingPolicy = pollingPolicy;
    this.readinessPoller = poller;
    this.httpClient = HttpClients.createDefault();
  }

  /** Describes the instance synchronously; used by {@link #getVm} and the readiness wait. */
  protected abstract Instance describe(String instanceId);

  /** Status values meaning "running" in this provider's vocabulary. */
  protected abstract String[] readyStatuses();

  /** Pulls the human-readable error message out of an error response body. */
  protected abstract String extractErrorMessage(JsonNode errorBody);

  public PollingPolicy getPollingPolicy() {
    return pollingPolicy;
  }

  @Override
  public CompletableFuture<Instance> getVm(String instanceId) {
    return runAsync(() -> describe(instanceId));
  }

  @Override
  public CompletableFuture<Void> destroyVm(String instanceId) {
    return runAsync(
        () -> {
          try {
            sendRequest("DELETE", deletePath(instanceId), null);
            logger.info("{} instance {} destroyed.", getProviderName(), instanceId);
          } catch (ApiResponseException e) {
            if (!e.isNotFound()) {
              throw e;
            }
            logger.warn(
                "{} instance {} not found; treating destroy as done.",
                getProviderName(),
                instanceId);
          }
          return null;
        });
  }

  /** Path of the DELETE call that destroys {@code instanceId}. */
  protected abstract String deletePath(String instanceId);

  /**
   * Blocks until the instance reports a ready status and has an address.
   *
   * @return The first ready snapshot.
   */
  protected Instance awaitReady(String instanceId) {
    Predicate<Instance> ready = ReadinessPoller.statusWithAddress(readyStatuses());
    return readinessPoller.awaitReady(instanceId, this::describe, ready, pollingPolicy);
  }

  protected <T> CompletableFuture<T> runAsync(Supplier<T> operation) {
    return CompletableFuture.supplyAsync(operation, providerExecutor);
  }

  /**
   * Sends a JSON request and returns the parsed response.
   *
   * @param method HTTP method.
   * @param path Path relative to the provider's base URL.
   * @param body Object serialized as the JSON body, or null.
   * @return The response document; an empty object for empty responses.
   * @throws ApiResponseException if the provider answered with a non-2xx status.
   * @throws ProviderOperationFailedException if the request could not be completed.
   */
  protected JsonNode sendRequest(String method, String path, Object body) {
    String jsonBody = body == null ? null : JsonParserUtil.toJson(body).orElse(null);
    HttpExecutor.HttpResult result;
    try {
      result = executeRequest(method, path, jsonBody);
    } catch (IOException e) {
      logger.error("{} request {} {} failed: {}", getProviderName(), method, path, e.getMessage());
      throw new ProviderOperationFailedException(
          getProviderName(),
          getProviderName() + " API request " + method + " " + path + " failed: " + e.getMessage(),
          e);
    }
    return handleResponse(method, path, result);
  }

  /**
   * Executes a raw request against the provider API.
   *
   * @param method HTTP method.
   * @param path Path relative to the base URL.
   * @param jsonBody Serialized body, or null.
   * @return Status code and body.
   * @throws IOException on transport failure.
   */
  protected HttpExecutor.HttpResult executeRequest(String method, String path, String jsonBody)
      throws IOException {
    return HttpExecutor.execute(httpClient, method, baseUrl + path, apiToken, jsonBody);
  }

  private JsonNode handleResponse(String method, String path, HttpExecutor.HttpResult result) {
    JsonNode document =
        JsonParserUtil.readTree(result.body()).orElseGet(JsonParserUtil::createObjectNode);
    if (result.isSuccess()) {
      return document;
    }
    String message = extractErrorMessage(document);
    if (message == null || message.isBlank()) {
      message = "HTTP " + result.statusCode();
    }
    String errorMessage =
        String.format("%s API error on %s %s: %s", getProviderName(), method, path, message);
    // Logged as an error by whichever caller treats the status as fatal.
    logger.debug(errorMessage);
    throw new ApiResponseException(getProviderName(), errorMessage, result.statusCode());
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
    logger.info("{} provider closed and resources released.", getProviderName());
  }
}
