package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Credential representation, used for password resets and inline user credentials.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(
    String id,
    String type,
    String userLabel,
    Long createdDate,
    String value,
    Boolean temporary
) {

  public static final String TYPE_PASSWORD = "password";

  public static Credential password(String password, boolean temporary) {
    return Credential.builder()
        .type(TYPE_PASSWORD)
        .value(password)
        .temporary(temporary)
        .build();
  }
}
