package com.example.keycloak.adapter.keycloak.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Query parameters of the group listing and count endpoints.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetGroupsParams(
    Boolean briefRepresentation,
    Boolean exact,
    Integer first,
    Integer max,
    String q,
    String search
) {

  public static GetGroupsParams empty() {
    return GetGroupsParams.builder().build();
  }
}
