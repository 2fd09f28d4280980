package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public realm descriptor served at {@code /realms/{realm}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IssuerResponse(
    String realm,
    @JsonProperty("public_key")
    String publicKey,
    @JsonProperty("token-service")
    String tokenService,
    @JsonProperty("account-service")
    String accountService,
    @JsonProperty("tokens-not-before")
    Long tokensNotBefore
) {}
