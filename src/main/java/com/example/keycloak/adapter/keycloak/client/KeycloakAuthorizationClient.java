package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Jwt;
import com.example.keycloak.adapter.keycloak.dto.RequestingPartyPermission;
import com.example.keycloak.adapter.keycloak.dto.RequestingPartyPermissionDecision;
import com.example.keycloak.adapter.keycloak.request.RequestingPartyTokenOptions;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.Request;

import java.util.List;

/**
 * Authorization services: requesting party tokens obtained through the UMA ticket grant.
 * All calls are authenticated with the requesting user's access token.
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakAuthorizationClient {

  private static final String ERROR_REQUESTING_PARTY = "could not get requesting party token";
  private static final TypeReference<List<RequestingPartyPermission>> PERMISSION_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  public Jwt getRequestingPartyToken(String token, String realm, RequestingPartyTokenOptions options) {
    return executor.fetch(requestingPartyRequest(token, realm, options), ERROR_REQUESTING_PARTY, Jwt.class);
  }

  /**
   * Permissions the requesting party would be granted, without issuing a token.
   */
  public List<RequestingPartyPermission> getRequestingPartyPermissions(String token, String realm,
                                                                       RequestingPartyTokenOptions options) {
    RequestingPartyTokenOptions permissionsMode =
        options.withResponseMode(RequestingPartyTokenOptions.RESPONSE_MODE_PERMISSIONS);
    return executor.fetch(requestingPartyRequest(token, realm, permissionsMode), ERROR_REQUESTING_PARTY,
                          PERMISSION_LIST);
  }

  /**
   * Whether all requested permissions are granted. A denial is reported by the server as 403.
   */
  public RequestingPartyPermissionDecision getRequestingPartyPermissionDecision(
      String token, String realm, RequestingPartyTokenOptions options) {
    RequestingPartyTokenOptions decisionMode =
        options.withResponseMode(RequestingPartyTokenOptions.RESPONSE_MODE_DECISION);
    return executor.fetch(requestingPartyRequest(token, realm, decisionMode), ERROR_REQUESTING_PARTY,
                          RequestingPartyPermissionDecision.class);
  }

  /**
   * Evaluates {@code permissions} ({@code resource#scope} entries) for the given audience
   * through the UMA ticket grant. With a {@code null} response mode the server issues a full
   * requesting party token.
   */
  public Jwt evaluatePermission(String userToken, String realm, String audience, String responseMode,
                                List<String> permissions) {
    RequestingPartyTokenOptions options = RequestingPartyTokenOptions.builder()
        .grantType(RequestingPartyTokenOptions.GRANT_UMA_TICKET)
        .audience(audience)
        .responseMode(responseMode)
        .permissions(permissions)
        .build();

    return getRequestingPartyToken(userToken, realm, options);
  }

  private Request requestingPartyRequest(String token, String realm, RequestingPartyTokenOptions options) {
    log.debug("Requesting party evaluation in realm {} for {} permission(s)", realm, options.permissionList().size());

    FormBody.Builder form = KeycloakRequestExecutor.formBuilder(options.toFormData());
    options.permissionList().forEach(permission -> form.add("permission", permission));

    return executor.bearerRequest(token)
        .url(executor.openIdConnectUrl(realm, "token"))
        .post(form.build())
        .build();
  }
}
