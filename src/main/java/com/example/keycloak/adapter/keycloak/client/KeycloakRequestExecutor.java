package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.KeycloakErrorResponse;
import com.example.keycloak.exception.KeycloakApiException;
import com.example.keycloak.exception.KeycloakException;
import com.example.keycloak.properties.KeycloakProperties;
import com.example.keycloak.util.RequestParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;

/**
 * Builds Keycloak URLs, dispatches requests and translates every outcome into either a decoded
 * body or a {@link KeycloakException}.
 *
 * <p>Each call is a single synchronous request. Nothing is retried or cached.
 */
@Slf4j
public class KeycloakRequestExecutor {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String HEADER_AUTHORIZATION = "Authorization";
  private static final String HEADER_LOCATION = "Location";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String OPENID_CONNECT_PATH = "protocol/openid-connect";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final KeycloakProperties properties;
  private final HttpUrl baseUrl;

  public KeycloakRequestExecutor(OkHttpClient httpClient, ObjectMapper objectMapper, KeycloakProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = wireMapper(objectMapper);
    this.properties = properties;
    this.baseUrl = HttpUrl.parse(properties.basePath());
    if (baseUrl == null) {
      throw new IllegalArgumentException("Keycloak base path is not a valid http(s) URL: " + properties.basePath());
    }
    log.info("Initialized Keycloak client for: {}", baseUrl);
  }

  /**
   * Keycloak's JSON names are fixed, so a naming strategy configured on the application's
   * mapper must not leak into requests or decoded representations.
   */
  static ObjectMapper wireMapper(ObjectMapper applicationMapper) {
    return applicationMapper.copy()
        .setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public KeycloakProperties properties() {
    return properties;
  }

  // --- URLs ---

  /**
   * {@code {basePath}/{realmsPath}/{realm}/{segments...}}, each segment percent-encoded.
   */
  public HttpUrl realmUrl(String realm, String... segments) {
    HttpUrl.Builder builder = baseUrl.newBuilder()
        .addPathSegments(properties.realmsPath())
        .addPathSegment(realm);
    return appendSegments(builder, segments);
  }

  public HttpUrl openIdConnectUrl(String realm, String... segments) {
    HttpUrl.Builder builder = realmUrl(realm).newBuilder().addPathSegments(OPENID_CONNECT_PATH);
    return appendSegments(builder, segments);
  }

  /**
   * {@code {basePath}/{adminRealmsPath}}, the collection of all realms.
   */
  public HttpUrl adminRealmsUrl() {
    return baseUrl.newBuilder().addPathSegments(properties.adminRealmsPath()).build();
  }

  public HttpUrl adminRealmUrl(String realm, String... segments) {
    HttpUrl.Builder builder = adminRealmsUrl().newBuilder().addPathSegment(realm);
    return appendSegments(builder, segments);
  }

  /**
   * Server wide admin resources, resolved against the parent of {@code adminRealmsPath}.
   */
  public HttpUrl adminUrl(String... segments) {
    String adminRealmsPath = properties.adminRealmsPath();
    int lastSlash = adminRealmsPath.lastIndexOf('/');
    HttpUrl.Builder builder = baseUrl.newBuilder();
    if (lastSlash > 0) {
      builder.addPathSegments(adminRealmsPath.substring(0, lastSlash));
    }
    return appendSegments(builder, segments);
  }

  public HttpUrl withQuery(HttpUrl url, Object params) {
    return RequestParams.withQuery(url, RequestParams.toQueryParams(objectMapper, params));
  }

  private static HttpUrl appendSegments(HttpUrl.Builder builder, String... segments) {
    for (String segment : segments) {
      builder.addPathSegment(segment);
    }
    return builder.build();
  }

  // --- Requests ---

  public Request.Builder request() {
    return new Request.Builder();
  }

  public Request.Builder bearerRequest(String accessToken) {
    return new Request.Builder().header(HEADER_AUTHORIZATION, BEARER_PREFIX + accessToken);
  }

  /**
   * Request authenticated with client credentials. Public clients have no secret and send none.
   */
  public Request.Builder basicAuthRequest(String clientId, String clientSecret) {
    Request.Builder builder = new Request.Builder();
    if (clientSecret != null && !clientSecret.isEmpty()) {
      builder.header(HEADER_AUTHORIZATION, Credentials.basic(clientId, clientSecret));
    }
    return builder;
  }

  public RequestBody json(Object body) {
    try {
      return RequestBody.create(objectMapper.writeValueAsBytes(body), JSON);
    } catch (JsonProcessingException e) {
      throw new KeycloakException("could not serialize request body", e);
    }
  }

  public static FormBody.Builder formBuilder(Map<String, String> fields) {
    FormBody.Builder builder = new FormBody.Builder();
    fields.forEach(builder::add);
    return builder;
  }

  public static FormBody form(Map<String, String> fields) {
    return formBuilder(fields).build();
  }

  /**
   * Rejects an empty id before a request is sent, as the server would answer with a
   * different resource or a misleading 404.
   */
  public static void requireNonEmpty(String value, String name, String errorMessage) {
    if (value == null || value.isEmpty()) {
      throw new KeycloakApiException(errorMessage + ": " + name + " shall not be empty", 400, null);
    }
  }

  // --- Execution ---

  public <T> T fetch(Request request, String errorMessage, Class<T> type) {
    return execute(request, errorMessage, body -> objectMapper.readValue(body, type));
  }

  public <T> T fetch(Request request, String errorMessage, TypeReference<T> type) {
    return execute(request, errorMessage, body -> objectMapper.readValue(body, type));
  }

  /**
   * Sends a request whose response body, if any, is discarded.
   */
  public void send(Request request, String errorMessage) {
    execute(request, errorMessage, null);
  }

  /**
   * Sends a create request and returns the id found in the {@code Location} header,
   * or an empty string when the server did not send one.
   */
  public String create(Request request, String errorMessage) {
    String location = execute(request, errorMessage, null, response -> response.header(HEADER_LOCATION));
    return RequestParams.idFromLocation(request.url(), location);
  }

  private <T> T execute(Request request, String errorMessage, BodyReader<T> reader) {
    return execute(request, errorMessage, reader, response -> null);
  }

  private <T> T execute(Request request, String errorMessage, BodyReader<T> reader,
                        HeaderReader<T> headerReader) {
    log.debug("Keycloak request: {} {}", request.method(), request.url().encodedPath());

    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw toApiException(request, response, errorMessage);
      }
      if (reader == null) {
        return headerReader.read(response);
      }

      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      if (content.isEmpty()) {
        throw new KeycloakException(errorMessage + ": empty response body");
      }
      T value = reader.read(content);
      if (value == null) {
        throw new KeycloakException(errorMessage + ": empty response body");
      }
      return value;

    } catch (IOException e) {
      throw new KeycloakException(errorMessage, e);
    }
  }

  private KeycloakApiException toApiException(Request request, Response response, String errorMessage)
      throws IOException {
    ResponseBody body = response.body();
    String content = body == null ? "" : body.string();
    String status = (response.code() + " " + response.message()).trim();
    String details = errorDetails(content);
    String message = details.isEmpty()
        ? "%s: %s".formatted(errorMessage, status)
        : "%s: %s: %s".formatted(errorMessage, status, details);

    log.warn("Keycloak request {} {} failed with status {}",
             request.method(), request.url().encodedPath(), response.code());
    return new KeycloakApiException(message, response.code(), content);
  }

  private String errorDetails(String content) {
    if (content.isBlank()) {
      return "";
    }
    try {
      return objectMapper.readValue(content, KeycloakErrorResponse.class).details();
    } catch (JsonProcessingException e) {
      log.debug("Keycloak error body is not JSON: {}", e.getOriginalMessage());
      return "";
    }
  }

  @FunctionalInterface
  private interface BodyReader<T> {
    T read(String body) throws IOException;
  }

  @FunctionalInterface
  private interface HeaderReader<T> {
    T read(Response response);
  }
}
