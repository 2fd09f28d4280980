package com.example.keycloak.config;

import com.example.keycloak.adapter.keycloak.client.KeycloakAuthorizationClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakClientsClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakGroupClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakOidcClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakRealmClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakRequestExecutor;
import com.example.keycloak.adapter.keycloak.client.KeycloakRoleClient;
import com.example.keycloak.adapter.keycloak.client.KeycloakUserClient;
import com.example.keycloak.properties.KeycloakProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.DependsOn;
import org.springframework.context.annotation.Import;

/**
 * Registers the Keycloak clients once {@code app.keycloak.base-path} is set.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnProperty(prefix = "app.keycloak", name = "base-path")
@EnableConfigurationProperties(KeycloakProperties.class)
@Import(HttpClientConfig.class)
public class KeycloakClientAutoConfiguration {

  @Bean
  public KeycloakConfigurationValidator keycloakConfigurationValidator(KeycloakProperties properties) {
    return new KeycloakConfigurationValidator(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  @DependsOn("keycloakConfigurationValidator")
  public KeycloakRequestExecutor keycloakRequestExecutor(
      @Qualifier(HttpClientConfig.KEYCLOAK_HTTP_CLIENT) OkHttpClient httpClient,
      ObjectProvider<ObjectMapper> objectMapper,
      KeycloakProperties properties) {
    return new KeycloakRequestExecutor(httpClient, objectMapper.getIfAvailable(ObjectMapper::new), properties);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakOidcClient keycloakOidcClient(KeycloakRequestExecutor executor) {
    return new KeycloakOidcClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakAuthorizationClient keycloakAuthorizationClient(KeycloakRequestExecutor executor) {
    return new KeycloakAuthorizationClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakRealmClient keycloakRealmClient(KeycloakRequestExecutor executor) {
    return new KeycloakRealmClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakUserClient keycloakUserClient(KeycloakRequestExecutor executor) {
    return new KeycloakUserClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakRoleClient keycloakRoleClient(KeycloakRequestExecutor executor) {
    return new KeycloakRoleClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakGroupClient keycloakGroupClient(KeycloakRequestExecutor executor) {
    return new KeycloakGroupClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakClientsClient keycloakClientsClient(KeycloakRequestExecutor executor) {
    return new KeycloakClientsClient(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public KeycloakClient keycloakClient(KeycloakOidcClient oidc,
                                       KeycloakAuthorizationClient authorization,
                                       KeycloakRealmClient realms,
                                       KeycloakUserClient users,
                                       KeycloakRoleClient roles,
                                       KeycloakGroupClient groups,
                                       KeycloakClientsClient clients) {
    return new KeycloakClient(oidc, authorization, realms, users, roles, groups, clients);
  }
}
