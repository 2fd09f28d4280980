package com.example.keycloak.adapter.keycloak.request;

import com.example.keycloak.util.RequestParams;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a UMA ticket grant. Each entry of {@code permissions} has the form
 * {@code resource[#scope]} and is sent as a separate {@code permission} field.
 */
@Builder(toBuilder = true)
public record RequestingPartyTokenOptions(
    String grantType,
    String ticket,
    String claimToken,
    String claimTokenFormat,
    String rpt,
    List<String> permissions,
    String audience,
    Boolean responseIncludeResourceName,
    Integer responsePermissionsLimit,
    Boolean submitRequest,
    String responseMode,
    String subjectToken
) {

  public static final String GRANT_UMA_TICKET = "urn:ietf:params:oauth:grant-type:uma-ticket";
  public static final String RESPONSE_MODE_PERMISSIONS = "permissions";
  public static final String RESPONSE_MODE_DECISION = "decision";

  public RequestingPartyTokenOptions withResponseMode(String mode) {
    return toBuilder().responseMode(mode).build();
  }

  public List<String> permissionList() {
    return permissions == null ? List.of() : permissions;
  }

  /**
   * Single valued form fields. {@code grant_type} falls back to the UMA ticket grant.
   */
  public Map<String, String> toFormData() {
    Map<String, String> form = new LinkedHashMap<>();
    RequestParams.putIfPresent(form, "grant_type", grantType == null || grantType.isEmpty() ? GRANT_UMA_TICKET : grantType);
    RequestParams.putIfPresent(form, "ticket", ticket);
    RequestParams.putIfPresent(form, "claim_token", claimToken);
    RequestParams.putIfPresent(form, "claim_token_format", claimTokenFormat);
    RequestParams.putIfPresent(form, "rpt", rpt);
    RequestParams.putIfPresent(form, "audience", audience);
    RequestParams.putIfPresent(form, "response_include_resource_name", responseIncludeResourceName);
    RequestParams.putIfPresent(form, "response_permissions_limit", responsePermissionsLimit);
    RequestParams.putIfPresent(form, "submit_request", submitRequest);
    RequestParams.putIfPresent(form, "response_mode", responseMode);
    RequestParams.putIfPresent(form, "subject_token", subjectToken);
    return form;
  }
}
