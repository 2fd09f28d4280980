package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Answer to a {@code response_mode=decision} evaluation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestingPartyPermissionDecision(Boolean result) {

  public boolean granted() {
    return Boolean.TRUE.equals(result);
  }
}
