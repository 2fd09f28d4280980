package com.example.keycloak.adapter.keycloak.request;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TokenOptionsTest {

  @Test
  void toFormData_defaultsToPasswordGrant() {
    Map<String, String> form = TokenOptions.builder().clientId("app").username("alice").password("pw").build()
        .toFormData();

    assertThat(form).containsExactly(
        Map.entry("client_id", "app"),
        Map.entry("grant_type", "password"),
        Map.entry("username", "alice"),
        Map.entry("password", "pw"));
  }

  @Test
  void toFormData_neverContainsClientSecret() {
    TokenOptions options = TokenOptions.builder()
        .clientId("app")
        .clientSecret("secret")
        .grantType(TokenOptions.GRANT_CLIENT_CREDENTIALS)
        .build();

    assertThat(options.hasClientSecret()).isTrue();
    assertThat(options.toFormData()).doesNotContainKey("client_secret")
        .containsEntry("grant_type", "client_credentials");
  }

  @Test
  void toFormData_joinsScopesAndResponseTypes() {
    Map<String, String> form = TokenOptions.builder()
        .grantType(TokenOptions.GRANT_AUTHORIZATION_CODE)
        .code("abc")
        .redirectUri("https://app/callback")
        .scopes(List.of("openid", "email"))
        .responseTypes(List.of("code", "id_token"))
        .build()
        .toFormData();

    assertThat(form).containsEntry("scope", "openid email")
        .containsEntry("response_type", "code id_token")
        .containsEntry("code", "abc")
        .containsEntry("redirect_uri", "https://app/callback");
  }

  @Test
  void toFormData_carriesTokenExchangeFields() {
    Map<String, String> form = TokenOptions.builder()
        .grantType("urn:ietf:params:oauth:grant-type:token-exchange")
        .subjectToken("external")
        .subjectIssuer("github")
        .requestedTokenType("urn:ietf:params:oauth:token-type:refresh_token")
        .audience("target")
        .build()
        .toFormData();

    assertThat(form).containsEntry("subject_token", "external")
        .containsEntry("subject_issuer", "github")
        .containsEntry("requested_token_type", "urn:ietf:params:oauth:token-type:refresh_token")
        .containsEntry("audience", "target");
  }

  @Test
  void emptySecret_isTreatedAsPublicClient() {
    assertThat(TokenOptions.builder().clientSecret("").build().hasClientSecret()).isFalse();
    assertThat(TokenOptions.builder().build().hasClientSecret()).isFalse();
  }
}
