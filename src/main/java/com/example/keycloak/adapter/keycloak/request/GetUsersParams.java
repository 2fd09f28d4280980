package com.example.keycloak.adapter.keycloak.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Query parameters of the user search endpoint. {@code q} is a space separated list of {@code attribute:value} pairs.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetUsersParams(
    Boolean briefRepresentation,
    String email,
    Boolean emailVerified,
    Boolean enabled,
    Boolean exact,
    Integer first,
    String firstName,
    String idpAlias,
    String idpUserId,
    String lastName,
    Integer max,
    String q,
    String search,
    String username
) {

  public static GetUsersParams empty() {
    return GetUsersParams.builder().build();
  }
}
