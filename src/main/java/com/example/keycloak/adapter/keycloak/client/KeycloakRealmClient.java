package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Realm;
import com.example.keycloak.adapter.keycloak.dto.ServerInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.List;

/**
 * Realm administration and server information.
 */
@RequiredArgsConstructor
public class KeycloakRealmClient {

  private static final TypeReference<List<Realm>> REALM_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  public Realm getRealm(String token, String realm) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm))
        .get()
        .build();

    return executor.fetch(request, "could not get realm", Realm.class);
  }

  /**
   * Every realm visible to the token's user.
   */
  public List<Realm> getRealms(String token) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmsUrl())
        .get()
        .build();

    return executor.fetch(request, "could not get realms", REALM_LIST);
  }

  /**
   * Creates a realm and returns its name as found in the {@code Location} header.
   */
  public String createRealm(String token, Realm realm) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmsUrl())
        .post(executor.json(realm))
        .build();

    return executor.create(request, "could not create realm");
  }

  /**
   * Updates the realm named by {@code realm.realm()}.
   */
  public void updateRealm(String token, Realm realm) {
    final String errMessage = "could not update realm";
    KeycloakRequestExecutor.requireNonEmpty(realm.realm(), "realm name", errMessage);

    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm.realm()))
        .put(executor.json(realm))
        .build();

    executor.send(request, errMessage);
  }

  public void deleteRealm(String token, String realm) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm))
        .delete()
        .build();

    executor.send(request, "could not delete realm");
  }

  public void clearRealmCache(String token, String realm) {
    executor.send(emptyPost(token, realm, "clear-realm-cache"), "could not clear realm cache");
  }

  public void clearUserCache(String token, String realm) {
    executor.send(emptyPost(token, realm, "clear-user-cache"), "could not clear user cache");
  }

  public void clearKeysCache(String token, String realm) {
    executor.send(emptyPost(token, realm, "clear-keys-cache"), "could not clear keys cache");
  }

  private Request emptyPost(String token, String realm, String action) {
    return executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, action))
        .post(RequestBody.create(new byte[0]))
        .build();
  }

  public ServerInfo getServerInfo(String token) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminUrl("serverinfo"))
        .get()
        .build();

    return executor.fetch(request, "could not get server info", ServerInfo.class);
  }
}
