package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * JSON Web Key Set of a realm.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CertResponse(List<Key> keys) {

  public Optional<Key> findKey(String kid) {
    if (keys == null || kid == null) {
      return Optional.empty();
    }
    return keys.stream().filter(key -> kid.equals(key.kid())).findFirst();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Key(
      String kid,
      String kty,
      String alg,
      String use,
      String n,
      String e,
      String crv,
      String x,
      String y,
      List<String> x5c,
      String x5t,
      @JsonProperty("x5t#S256")
      String x5tS256
  ) {}
}
