package com.example.keycloak.adapter.keycloak.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Query parameters of the client listing endpoint. {@code clientId} matches exactly unless {@code search} is set.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetClientsParams(
    String clientId,
    Integer first,
    Integer max,
    String q,
    Boolean search,
    Boolean viewableOnly
) {

  public static GetClientsParams empty() {
    return GetClientsParams.builder().build();
  }
}
