package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token endpoint response, also returned for requesting party tokens.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Jwt(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("id_token")
    String idToken,
    @JsonProperty("expires_in")
    Long expiresIn,
    @JsonProperty("refresh_expires_in")
    Long refreshExpiresIn,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("not-before-policy")
    Long notBeforePolicy,
    @JsonProperty("session_state")
    String sessionState,
    @JsonProperty("scope")
    String scope
) {

  public boolean hasIdToken() {
    return idToken != null && !idToken.isEmpty();
  }

  /**
   * Offline tokens never expire on their own, so the server reports no refresh lifetime.
   */
  public boolean hasOfflineRefreshToken() {
    return refreshExpiresIn != null && refreshExpiresIn == 0;
  }
}
