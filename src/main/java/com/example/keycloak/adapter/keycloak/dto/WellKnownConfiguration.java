package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenID Provider metadata served at {@code .well-known/openid-configuration}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WellKnownConfiguration(
    @JsonProperty("issuer")
    String issuer,
    @JsonProperty("authorization_endpoint")
    String authorizationEndpoint,
    @JsonProperty("token_endpoint")
    String tokenEndpoint,
    @JsonProperty("introspection_endpoint")
    String introspectionEndpoint,
    @JsonProperty("userinfo_endpoint")
    String userinfoEndpoint,
    @JsonProperty("end_session_endpoint")
    String endSessionEndpoint,
    @JsonProperty("revocation_endpoint")
    String revocationEndpoint,
    @JsonProperty("jwks_uri")
    String jwksUri,
    @JsonProperty("grant_types_supported")
    List<String> grantTypesSupported,
    @JsonProperty("response_types_supported")
    List<String> responseTypesSupported,
    @JsonProperty("scopes_supported")
    List<String> scopesSupported,
    @JsonProperty("id_token_signing_alg_values_supported")
    List<String> idTokenSigningAlgValuesSupported
) {}
