package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Active or offline session of a user. {@code clients} maps client ids to client names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserSession(
    String id,
    String username,
    String userId,
    String ipAddress,
    Long start,
    Long lastAccess,
    Boolean rememberMe,
    Map<String, String> clients
) {}
