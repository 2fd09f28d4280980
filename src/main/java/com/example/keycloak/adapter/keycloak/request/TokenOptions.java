package com.example.keycloak.adapter.keycloak.request;

import com.example.keycloak.util.RequestParams;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a token endpoint request.
 * The client secret travels as HTTP Basic credentials and is never part of the form.
 */
@Builder(toBuilder = true)
public record TokenOptions(
    String clientId,
    String clientSecret,
    String grantType,
    String refreshToken,
    List<String> scopes,
    List<String> responseTypes,
    String permission,
    String username,
    String password,
    String totp,
    String code,
    String redirectUri,
    String clientAssertionType,
    String clientAssertion,
    String subjectToken,
    String subjectIssuer,
    String requestedSubject,
    String requestedTokenType,
    String audience
) {

  public static final String GRANT_PASSWORD = "password";
  public static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
  public static final String GRANT_REFRESH_TOKEN = "refresh_token";
  public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";

  public boolean hasClientSecret() {
    return clientSecret != null && !clientSecret.isEmpty();
  }

  /**
   * Form fields of the request. {@code grant_type} falls back to {@code password}.
   */
  public Map<String, String> toFormData() {
    Map<String, String> form = new LinkedHashMap<>();
    RequestParams.putIfPresent(form, "client_id", clientId);
    RequestParams.putIfPresent(form, "grant_type", grantType == null || grantType.isEmpty() ? GRANT_PASSWORD : grantType);
    RequestParams.putIfPresent(form, "refresh_token", refreshToken);
    if (scopes != null) {
      form.put("scope", String.join(" ", scopes));
    }
    if (responseTypes != null) {
      form.put("response_type", String.join(" ", responseTypes));
    }
    RequestParams.putIfPresent(form, "permission", permission);
    RequestParams.putIfPresent(form, "username", username);
    RequestParams.putIfPresent(form, "password", password);
    RequestParams.putIfPresent(form, "totp", totp);
    RequestParams.putIfPresent(form, "code", code);
    RequestParams.putIfPresent(form, "redirect_uri", redirectUri);
    RequestParams.putIfPresent(form, "client_assertion_type", clientAssertionType);
    RequestParams.putIfPresent(form, "client_assertion", clientAssertion);
    RequestParams.putIfPresent(form, "subject_token", subjectToken);
    RequestParams.putIfPresent(form, "subject_issuer", subjectIssuer);
    RequestParams.putIfPresent(form, "requested_subject", requestedSubject);
    RequestParams.putIfPresent(form, "requested_token_type", requestedTokenType);
    RequestParams.putIfPresent(form, "audience", audience);
    return form;
  }
}
