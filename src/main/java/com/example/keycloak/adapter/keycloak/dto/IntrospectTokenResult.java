package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Token introspection response (RFC 7662) including the permissions of a requesting party token.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectTokenResult(
    Boolean active,
    Long exp,
    Long nbf,
    Long iat,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    List<String> aud,
    String typ,
    @JsonProperty("auth_time")
    Long authTime,
    String jti,
    @JsonProperty("client_id")
    String clientId,
    String username,
    String scope,
    String sub,
    List<ResourcePermission> permissions
) {

  public boolean activeToken() {
    return Boolean.TRUE.equals(active);
  }

  /**
   * A single resource grant carried by a requesting party token.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ResourcePermission(
      String rsid,
      String rsname,
      @JsonProperty("resource_id")
      String resourceId,
      List<String> scopes,
      @JsonProperty("resource_scopes")
      List<String> resourceScopes
  ) {}
}
