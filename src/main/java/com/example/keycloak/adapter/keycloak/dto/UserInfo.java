package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standard OpenID Connect claims returned by the userinfo endpoint.
 * Custom mapper claims are only available through the raw userinfo call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfo(
    String sub,
    String name,
    @JsonProperty("preferred_username")
    String preferredUsername,
    @JsonProperty("given_name")
    String givenName,
    @JsonProperty("family_name")
    String familyName,
    String email,
    @JsonProperty("email_verified")
    Boolean emailVerified,
    String locale,
    String zoneinfo,
    @JsonProperty("updated_at")
    Long updatedAt
) {}
