package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.CertResponse;
import com.example.keycloak.adapter.keycloak.dto.IntrospectTokenResult;
import com.example.keycloak.adapter.keycloak.dto.IssuerResponse;
import com.example.keycloak.adapter.keycloak.dto.Jwt;
import com.example.keycloak.adapter.keycloak.dto.UserInfo;
import com.example.keycloak.adapter.keycloak.dto.WellKnownConfiguration;
import com.example.keycloak.adapter.keycloak.request.TokenOptions;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenID Connect endpoints of a realm: token issuance, userinfo, introspection, logout,
 * revocation and the public discovery documents.
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakOidcClient {

  private static final String TOKEN_TYPE_HINT_RPT = "requesting_party_token";
  private static final TypeReference<Map<String, Object>> RAW_USER_INFO = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  /**
   * Calls the token endpoint with arbitrary options.
   */
  public Jwt getToken(String realm, TokenOptions options) {
    log.debug("Requesting token from realm {} with grant type {}", realm, options.grantType());

    Request.Builder builder = options.hasClientSecret()
        ? executor.basicAuthRequest(options.clientId(), options.clientSecret())
        : executor.request();
    Request request = builder
        .url(executor.openIdConnectUrl(realm, "token"))
        .post(KeycloakRequestExecutor.form(options.toFormData()))
        .build();

    return executor.fetch(request, "could not get token", Jwt.class);
  }

  /**
   * Resource owner password login.
   */
  public Jwt login(String clientId, String clientSecret, String realm, String username, String password) {
    return getToken(realm, TokenOptions.builder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .grantType(TokenOptions.GRANT_PASSWORD)
        .username(username)
        .password(password)
        .build());
  }

  /**
   * Password login for users with a one-time password configured.
   */
  public Jwt loginOtp(String clientId, String clientSecret, String realm, String username, String password,
                      String totp) {
    return getToken(realm, TokenOptions.builder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .grantType(TokenOptions.GRANT_PASSWORD)
        .username(username)
        .password(password)
        .totp(totp)
        .build());
  }

  /**
   * Client credentials login, yields a token for the client's service account.
   */
  public Jwt loginClient(String clientId, String clientSecret, String realm) {
    return getToken(realm, TokenOptions.builder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .grantType(TokenOptions.GRANT_CLIENT_CREDENTIALS)
        .build());
  }

  /**
   * Password login against the admin client, normally in the {@code master} realm.
   */
  public Jwt loginAdmin(String username, String password, String realm) {
    return getToken(realm, TokenOptions.builder()
        .clientId(executor.properties().adminClientId())
        .grantType(TokenOptions.GRANT_PASSWORD)
        .username(username)
        .password(password)
        .build());
  }

  public Jwt refreshToken(String refreshToken, String clientId, String clientSecret, String realm) {
    return getToken(realm, TokenOptions.builder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .grantType(TokenOptions.GRANT_REFRESH_TOKEN)
        .refreshToken(refreshToken)
        .build());
  }

  public UserInfo getUserInfo(String accessToken, String realm) {
    return executor.fetch(userInfoRequest(accessToken, realm), "could not get user info", UserInfo.class);
  }

  /**
   * Userinfo claims as sent by the server, including those added by protocol mappers.
   */
  public Map<String, Object> getRawUserInfo(String accessToken, String realm) {
    return executor.fetch(userInfoRequest(accessToken, realm), "could not get user info", RAW_USER_INFO);
  }

  private Request userInfoRequest(String accessToken, String realm) {
    return executor.bearerRequest(accessToken)
        .url(executor.openIdConnectUrl(realm, "userinfo"))
        .get()
        .build();
  }

  /**
   * Introspects an access or requesting party token on behalf of a confidential client.
   */
  public IntrospectTokenResult introspectToken(String token, String clientId, String clientSecret, String realm) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("token_type_hint", TOKEN_TYPE_HINT_RPT);
    form.put("token", token);

    Request request = executor.basicAuthRequest(clientId, clientSecret)
        .url(executor.openIdConnectUrl(realm, "token", "introspect"))
        .post(KeycloakRequestExecutor.form(form))
        .build();

    return executor.fetch(request, "could not introspect requesting party token", IntrospectTokenResult.class);
  }

  /**
   * Ends the session the refresh token belongs to.
   */
  public void logout(String clientId, String clientSecret, String realm, String refreshToken) {
    Request request = executor.basicAuthRequest(clientId, clientSecret)
        .url(executor.openIdConnectUrl(realm, "logout"))
        .post(KeycloakRequestExecutor.form(logoutForm(clientId, refreshToken)))
        .build();

    executor.send(request, "could not logout");
  }

  /**
   * Logout for public clients, which authenticate with the user's access token instead of a secret.
   */
  public void logoutPublicClient(String clientId, String realm, String accessToken, String refreshToken) {
    Request request = executor.bearerRequest(accessToken)
        .url(executor.openIdConnectUrl(realm, "logout"))
        .post(KeycloakRequestExecutor.form(logoutForm(clientId, refreshToken)))
        .build();

    executor.send(request, "could not logout public client");
  }

  private static Map<String, String> logoutForm(String clientId, String refreshToken) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("client_id", clientId);
    form.put("refresh_token", refreshToken);
    return form;
  }

  /**
   * Revokes a refresh or offline token (RFC 7009).
   */
  public void revokeToken(String realm, String clientId, String clientSecret, String refreshToken) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("client_id", clientId);
    form.put("token", refreshToken);

    Request request = executor.basicAuthRequest(clientId, clientSecret)
        .url(executor.openIdConnectUrl(realm, "revoke"))
        .post(KeycloakRequestExecutor.form(form))
        .build();

    executor.send(request, "could not revoke token");
  }

  public IssuerResponse getIssuer(String realm) {
    Request request = executor.request()
        .url(executor.realmUrl(realm))
        .get()
        .build();

    return executor.fetch(request, "could not get issuer", IssuerResponse.class);
  }

  public CertResponse getCerts(String realm) {
    Request request = executor.request()
        .url(executor.openIdConnectUrl(realm, "certs"))
        .get()
        .build();

    return executor.fetch(request, "could not get certs", CertResponse.class);
  }

  public WellKnownConfiguration getWellKnownOpenIdConfiguration(String realm) {
    Request request = executor.request()
        .url(executor.realmUrl(realm, ".well-known", "openid-configuration"))
        .get()
        .build();

    return executor.fetch(request, "could not get well-known openid configuration", WellKnownConfiguration.class);
  }
}
