package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Permission granted to the requesting party, returned with {@code response_mode=permissions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestingPartyPermission(
    Map<String, List<String>> claims,
    String rsid,
    String rsname,
    List<String> scopes
) {}
