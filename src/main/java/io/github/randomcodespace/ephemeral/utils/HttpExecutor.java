package io.github.randomcodespace.ephemeral.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for issuing bearer-authenticated JSON requests against provider APIs. */
public class HttpExecutor {
  private static final Logger logger = LoggerFactory.getLogger(HttpExecutor.class);

  /** Represents the result of an HTTP exchange. */
  public record HttpResult(int statusCode, String body) {
    public boolean isSuccess() {
      return statusCode >= 200 && statusCode < 300;
    }
  }

  private HttpExecutor() {}

  /**
   * Executes a request and reads the full response body.
   *
   * @param client The HTTP client to use.
   * @param method HTTP method, e.g. "GET".
   * @param uri Absolute request URI.
   * @param bearerToken API token sent as {@code Authorization: Bearer}.
   * @param jsonBody Request body, or null for none.
   * @return The status code and body of the response.
   * @throws IOException on connection or protocol failure.
   */
  public static HttpResult execute(
      CloseableHttpClient client, String method, String uri, String bearerToken, String jsonBody)
      throws IOException {
    ClassicRequestBuilder builder =
        ClassicRequestBuilder.create(method)
            .setUri(uri)
            .addHeader("Authorization", "Bearer " + bearerToken)
            .addHeader("Accept", "application/json");
    if (jsonBody != null) {
      builder.setEntity(new StringEntity(jsonBody, ContentType.APPLICATION_JSON));
    }
    ClassicHttpRequest request = builder.build();

    logger.debug("Executing request: {} {}", method, uri);
    HttpResult result =
        client.execute(
            request,
            response -> {
              String body =
                  response.getEntity() == null
                      ? ""
                      : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
              return new HttpResult(response.getCode(), body);
            });
    if (result.isSuccess()) {
      logger.debug("Request succeeded: {} {} -> {}", method, uri, result.statusCode());
    } else {
      logger.warn("Request failed: {} {} -> {}", method, uri, result.statusCode());
    }
    return result;
  }
}
