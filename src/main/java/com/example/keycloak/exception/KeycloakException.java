package com.example.keycloak.exception;


/**
 * Keycloak Exception
 *
 * Raised when a call could not be completed, either because the request never got a response
 * or because the response could not be decoded.
 */
public class KeycloakException extends RuntimeException {
  public KeycloakException(String message) {
    super(message);
  }

  public KeycloakException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * HTTP status returned by the server, {@code 0} when no response was received.
   */
  public int getStatusCode() {
    return 0;
  }
}
