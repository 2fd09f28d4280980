package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Jwt;
import com.example.keycloak.adapter.keycloak.dto.User;
import com.example.keycloak.adapter.keycloak.request.GetUsersParams;
import com.example.keycloak.properties.KeycloakProperties;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeycloakClientTest extends AbstractKeycloakClientTest {

  @Test
  void create_wiresEveryGroupToTheSameServer() throws Exception {
    KeycloakClient keycloak = KeycloakClient.create(KeycloakProperties.withBasePath(server.url("/auth").toString()));
    enqueueJson("{\"access_token\":\"" + TOKEN + "\",\"expires_in\":60}");
    enqueueJson("[{\"id\":\"u1\",\"username\":\"alice\"}]");

    Jwt jwt = keycloak.oidc().loginAdmin("admin", "admin", "master");
    List<User> users = keycloak.users().getUsers(jwt.accessToken(), REALM, GetUsersParams.empty());

    assertThat(users).extracting(User::id).containsExactly("u1");
    assertThat(takeRequest().getPath()).isEqualTo("/auth/realms/master/protocol/openid-connect/token");
    RecordedRequest usersRequest = takeRequest();
    assertThat(usersRequest.getPath()).isEqualTo("/auth/admin/realms/test/users");
    assertBearer(usersRequest);
  }

  @Test
  void create_fromExecutor_sharesIt() {
    KeycloakClient keycloak = KeycloakClient.create(executor);

    assertThat(keycloak).hasNoNullFieldsOrProperties();
  }
}
