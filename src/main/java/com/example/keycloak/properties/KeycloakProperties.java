package com.example.keycloak.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import okhttp3.logging.HttpLoggingInterceptor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Connection settings for the Keycloak REST client.
 * Bound from {@code app.keycloak.*}; unset values fall back to the defaults below.
 */
@Validated
@ConfigurationProperties(prefix = "app.keycloak")
public record KeycloakProperties(
    @NotBlank String basePath,
    @DefaultValue("realms") @NotBlank String realmsPath,
    @DefaultValue("admin/realms") @NotBlank String adminRealmsPath,
    @DefaultValue("admin-cli") @NotBlank String adminClientId,
    @NotNull @Valid @DefaultValue HttpProperties http
) {

  /**
   * OkHttp client configuration
   */
  public record HttpProperties(
      @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
      @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
      @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration writeTimeout,
      @DefaultValue("NONE") HttpLoggingInterceptor.Level loggingLevel
  ) {
    public static HttpProperties defaults() {
      return new HttpProperties(
          Duration.ofSeconds(3),
          Duration.ofSeconds(10),
          Duration.ofSeconds(10),
          HttpLoggingInterceptor.Level.NONE);
    }
  }

  /**
   * Properties pointing at the given server with every other setting left at its default.
   */
  public static KeycloakProperties withBasePath(String basePath) {
    return new KeycloakProperties(basePath, "realms", "admin/realms", "admin-cli", HttpProperties.defaults());
  }
}
