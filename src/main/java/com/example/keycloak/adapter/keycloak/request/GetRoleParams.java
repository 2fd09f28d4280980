package com.example.keycloak.adapter.keycloak.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetRoleParams(
    Boolean briefRepresentation,
    Integer first,
    Integer max,
    String search
) {

  public static GetRoleParams empty() {
    return GetRoleParams.builder().build();
  }
}
