package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Admin user representation.
 * Realm roles and group memberships are ignored on creation and must be attached afterwards.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    String id,
    Long createdTimestamp,
    String username,
    Boolean enabled,
    Boolean totp,
    Boolean emailVerified,
    String firstName,
    String lastName,
    String email,
    String federationLink,
    String serviceAccountClientId,
    Map<String, List<String>> attributes,
    List<String> disableableCredentialTypes,
    List<String> requiredActions,
    Map<String, Boolean> access,
    Map<String, List<String>> clientRoles,
    List<String> realmRoles,
    List<String> groups,
    List<Credential> credentials
) {}
