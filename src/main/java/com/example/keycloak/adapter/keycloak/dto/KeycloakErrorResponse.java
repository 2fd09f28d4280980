package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Error body shapes used by Keycloak: OAuth2 errors ({@code error}, {@code error_description})
 * and admin API errors ({@code errorMessage}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeycloakErrorResponse(
    @JsonProperty("error")
    String error,
    @JsonProperty("errorMessage")
    String errorMessage,
    @JsonProperty("error_description")
    String errorDescription
) {

  /**
   * Non-empty fields joined with {@code ": "}, empty when the body carried none of them.
   */
  public String details() {
    return Stream.of(error, errorMessage, errorDescription)
        .filter(part -> part != null && !part.isBlank())
        .collect(Collectors.joining(": "));
  }
}
