package com.example.keycloak.config;

import com.example.keycloak.properties.KeycloakProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.logging.HttpLoggingInterceptor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.util.Arrays;

/**
 * OkHttp client used for every Keycloak call.
 *
 * Failed connections are not retried and redirects are not followed, so each
 * operation maps to exactly one request.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

  public static final String KEYCLOAK_HTTP_CLIENT = "keycloakOkHttpClient";

  @Bean(name = KEYCLOAK_HTTP_CLIENT)
  @ConditionalOnMissingBean(name = KEYCLOAK_HTTP_CLIENT)
  @DependsOn("keycloakConfigurationValidator")
  public OkHttpClient keycloakOkHttpClient(KeycloakProperties properties) {
    return buildHttpClient(properties.http());
  }

  public static OkHttpClient buildHttpClient(KeycloakProperties.HttpProperties http) {
    OkHttpClient.Builder builder = new OkHttpClient.Builder()
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(http.connectTimeout())
        .readTimeout(http.readTimeout())
        .writeTimeout(http.writeTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false);

    HttpLoggingInterceptor.Level level = effectiveLoggingLevel(http.loggingLevel());
    if (level != HttpLoggingInterceptor.Level.NONE) {
      HttpLoggingInterceptor logging = new HttpLoggingInterceptor(message -> log.debug(message));
      logging.redactHeader("Authorization");
      logging.setLevel(level);
      builder.addNetworkInterceptor(logging);
    }
    return builder.build();
  }

  /**
   * Bodies carry passwords, one-time codes and tokens, so wire logging stops at headers.
   */
  static HttpLoggingInterceptor.Level effectiveLoggingLevel(HttpLoggingInterceptor.Level requested) {
    if (requested == null) {
      return HttpLoggingInterceptor.Level.NONE;
    }
    if (requested == HttpLoggingInterceptor.Level.BODY) {
      log.warn("Keycloak HTTP logging level BODY would log credentials, using HEADERS instead");
      return HttpLoggingInterceptor.Level.HEADERS;
    }
    return requested;
  }
}
