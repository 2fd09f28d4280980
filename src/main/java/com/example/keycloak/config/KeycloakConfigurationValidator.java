package com.example.keycloak.config;

import com.example.keycloak.properties.KeycloakProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Enforces the rules on {@link KeycloakProperties} that bean validation cannot express
 * and fails fast with every violation listed.
 */
@Slf4j
@RequiredArgsConstructor
public class KeycloakConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS for non-local hosts: %s";
  private static final String ERROR_SLASHES = "%s must not start or end with '/': %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be greater than zero.";
  private static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1", "[::1]", "::1");

  private final KeycloakProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating Keycloak client configuration...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Keycloak configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Keycloak client configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateBasePath(errors);
    validatePath(properties.realmsPath(), "Realms path", errors);
    validatePath(properties.adminRealmsPath(), "Admin realms path", errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validateBasePath(List<String> errors) {
    String basePath = properties.basePath();
    HttpUrl url = basePath == null ? null : HttpUrl.parse(basePath);
    if (url == null) {
      errors.add(ERROR_INVALID_URL.formatted("Keycloak base path", basePath));
      return;
    }
    if (!url.isHttps() && !LOCAL_HOSTS.contains(url.host())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted("Keycloak base path", basePath));
    }
  }

  private void validatePath(String path, String fieldName, List<String> errors) {
    if (path != null && (path.startsWith("/") || path.endsWith("/"))) {
      errors.add(ERROR_SLASHES.formatted(fieldName, path));
    }
  }

  private void validateHttpConfig(List<String> errors) {
    KeycloakProperties.HttpProperties http = properties.http();
    requirePositive(http.connectTimeout(), "Connect timeout", errors);
    requirePositive(http.readTimeout(), "Read timeout", errors);
    requirePositive(http.writeTimeout(), "Write timeout", errors);
  }

  private void requirePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(fieldName));
    }
  }
}
