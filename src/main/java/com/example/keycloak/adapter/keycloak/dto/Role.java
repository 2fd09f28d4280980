package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Realm or client role representation.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Role(
    String id,
    String name,
    String description,
    Boolean scopeParamRequired,
    Boolean composite,
    Composites composites,
    Boolean clientRole,
    String containerId,
    Map<String, List<String>> attributes
) {

  /**
   * Names of the roles a composite role is made of, keyed by client for client roles.
   */
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Composites(
      List<String> realm,
      Map<String, List<String>> client
  ) {}
}
