package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.config.HttpClientConfig;
import com.example.keycloak.properties.KeycloakProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

/**
 * Single entry point to every Keycloak endpoint group.
 * All members share one {@link KeycloakRequestExecutor}.
 */
public record KeycloakClient(
    KeycloakOidcClient oidc,
    KeycloakAuthorizationClient authorization,
    KeycloakRealmClient realms,
    KeycloakUserClient users,
    KeycloakRoleClient roles,
    KeycloakGroupClient groups,
    KeycloakClientsClient clients
) {

  public static KeycloakClient create(KeycloakRequestExecutor executor) {
    return new KeycloakClient(
        new KeycloakOidcClient(executor),
        new KeycloakAuthorizationClient(executor),
        new KeycloakRealmClient(executor),
        new KeycloakUserClient(executor),
        new KeycloakRoleClient(executor),
        new KeycloakGroupClient(executor),
        new KeycloakClientsClient(executor));
  }

  public static KeycloakClient create(OkHttpClient httpClient, ObjectMapper objectMapper,
                                      KeycloakProperties properties) {
    return create(new KeycloakRequestExecutor(httpClient, objectMapper, properties));
  }

  /**
   * Client outside of a Spring context, with its own OkHttp client and object mapper.
   */
  public static KeycloakClient create(KeycloakProperties properties) {
    return create(HttpClientConfig.buildHttpClient(properties.http()), new ObjectMapper(), properties);
  }
}
