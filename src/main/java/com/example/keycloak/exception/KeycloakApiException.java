package com.example.keycloak.exception;

/**
 * Raised when the server answered with a non-2xx status.
 * Carries the status code and the raw response body unchanged.
 */
public class KeycloakApiException extends KeycloakException {

  private final int statusCode;
  private final String responseBody;

  public KeycloakApiException(String message, int statusCode, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  @Override
  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
