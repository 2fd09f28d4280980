package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Application registered in a realm. {@code id} is the internal id used in admin URLs,
 * {@code clientId} the OAuth2 client identifier.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRepresentation(
    String id,
    String clientId,
    String name,
    String description,
    String protocol,
    String rootUrl,
    String baseUrl,
    Boolean enabled,
    Boolean publicClient,
    Boolean bearerOnly,
    Boolean standardFlowEnabled,
    Boolean directAccessGrantsEnabled,
    Boolean serviceAccountsEnabled,
    Boolean authorizationServicesEnabled,
    List<String> redirectUris,
    List<String> webOrigins,
    Map<String, String> attributes
) {}
