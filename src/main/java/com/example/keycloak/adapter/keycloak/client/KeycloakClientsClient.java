package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.ClientRepresentation;
import com.example.keycloak.adapter.keycloak.request.GetClientsParams;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import okhttp3.Request;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of the applications registered in a realm. Admin URLs address clients by their
 * internal id ({@code idOfClient}), which is resolved here from the OAuth2 client id.
 */
@RequiredArgsConstructor
public class KeycloakClientsClient {

  private static final TypeReference<List<ClientRepresentation>> CLIENT_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  public List<ClientRepresentation> getClients(String token, String realm, GetClientsParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "clients"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get clients", CLIENT_LIST);
  }

  public ClientRepresentation getClient(String token, String realm, String idOfClient) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "clients", idOfClient))
        .get()
        .build();

    return executor.fetch(request, "could not get client", ClientRepresentation.class);
  }

  /**
   * Internal id of the client registered under {@code clientId}, if any.
   */
  public Optional<String> findIdOfClient(String token, String realm, String clientId) {
    GetClientsParams params = GetClientsParams.builder().clientId(clientId).build();
    return getClients(token, realm, params).stream()
        .filter(client -> clientId.equals(client.clientId()))
        .map(ClientRepresentation::id)
        .findFirst();
  }
}
