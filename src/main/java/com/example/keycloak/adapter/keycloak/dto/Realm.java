package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Map;

/**
 * Subset of the admin realm representation. Unknown settings are dropped on read, so an
 * update only touches the fields set here.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Realm(
    String id,
    String realm,
    String displayName,
    Boolean enabled,
    String sslRequired,
    Boolean registrationAllowed,
    Boolean loginWithEmailAllowed,
    Boolean duplicateEmailsAllowed,
    Boolean resetPasswordAllowed,
    Boolean editUsernameAllowed,
    Boolean bruteForceProtected,
    Integer accessTokenLifespan,
    Integer ssoSessionIdleTimeout,
    Integer ssoSessionMaxLifespan,
    Integer offlineSessionIdleTimeout,
    String defaultSignatureAlgorithm,
    Map<String, String> attributes
) {}
