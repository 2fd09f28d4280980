package com.example.keycloak.adapter.keycloak.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetUsersByRoleParams(
    Integer first,
    Integer max,
    Boolean briefRepresentation
) {

  public static GetUsersByRoleParams empty() {
    return GetUsersByRoleParams.builder().build();
  }
}
