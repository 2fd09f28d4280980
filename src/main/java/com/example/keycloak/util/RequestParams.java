package com.example.keycloak.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for turning parameter records into query strings and form fields.
 */
public final class RequestParams {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private RequestParams() {
  }

  /**
   * Converts a parameter record into query parameters. Fields that are {@code null} are skipped,
   * everything else is rendered with {@link String#valueOf(Object)}.
   *
   * @throws IllegalArgumentException if the object cannot be represented as a flat JSON object
   */
  public static Map<String, String> toQueryParams(ObjectMapper objectMapper, Object params) {
    Map<String, String> query = new LinkedHashMap<>();
    if (params == null) {
      return query;
    }
    Map<String, Object> values = objectMapper.convertValue(params, MAP_TYPE);
    values.forEach((name, value) -> putIfPresent(query, name, value));
    return query;
  }

  public static HttpUrl withQuery(HttpUrl url, Map<String, String> query) {
    if (query.isEmpty()) {
      return url;
    }
    HttpUrl.Builder builder = url.newBuilder();
    query.forEach(builder::addQueryParameter);
    return builder.build();
  }

  public static void putIfPresent(Map<String, String> target, String name, Object value) {
    if (value != null) {
      target.put(name, String.valueOf(value));
    }
  }

  /**
   * Id of a created resource: the last non-empty, percent-decoded path segment of the
   * {@code Location} header, resolved against the request URL when relative.
   */
  public static String idFromLocation(HttpUrl requestUrl, String location) {
    if (location == null || location.isEmpty()) {
      return "";
    }
    HttpUrl url = requestUrl.resolve(location);
    if (url == null) {
      return "";
    }
    List<String> segments = url.pathSegments();
    for (int i = segments.size() - 1; i >= 0; i--) {
      if (!segments.get(i).isEmpty()) {
        return segments.get(i);
      }
    }
    return "";
  }
}
