package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Credential;
import com.example.keycloak.adapter.keycloak.dto.FederatedIdentity;
import com.example.keycloak.adapter.keycloak.dto.Group;
import com.example.keycloak.adapter.keycloak.dto.Role;
import com.example.keycloak.adapter.keycloak.dto.User;
import com.example.keycloak.adapter.keycloak.dto.UserSession;
import com.example.keycloak.adapter.keycloak.request.GetGroupsParams;
import com.example.keycloak.adapter.keycloak.request.GetUsersByRoleParams;
import com.example.keycloak.adapter.keycloak.request.GetUsersParams;
import com.example.keycloak.exception.KeycloakApiException;
import com.example.keycloak.exception.KeycloakException;
import com.fasterxml.jackson.core.type.TypeReference;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeycloakUserClientTest extends AbstractKeycloakClientTest {

  private static final String USER_ID = "6b3a0f9e-1c52-4d7e-9a6f-2c8d1e4b7a90";

  private KeycloakUserClient client;

  @BeforeEach
  void setUp() {
    client = new KeycloakUserClient(executor);
  }

  @Test
  void createUser_returnsIdFromLocation() throws Exception {
    enqueueCreated(server.url("/admin/realms/test/users/" + USER_ID).toString());

    String id = client.createUser(TOKEN, REALM, User.builder().username("alice").enabled(true).build());

    assertThat(id).isEqualTo(USER_ID);

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users");
    assertBearer(request);
    Map<String, Object> body = objectMapper.readValue(request.getBody().readUtf8(), new TypeReference<>() {});
    assertThat(body).containsEntry("username", "alice")
        .containsEntry("enabled", true)
        .doesNotContainKey("email");
  }

  @Test
  void createUser_withDuplicateUsername_throwsConflict() {
    enqueueError(409, "{\"errorMessage\":\"User exists with same username\"}");

    assertThatThrownBy(() -> client.createUser(TOKEN, REALM, User.builder().username("alice").build()))
        .isInstanceOfSatisfying(KeycloakApiException.class, e -> {
          assertThat(e.getStatusCode()).isEqualTo(409);
          assertThat(e.getMessage()).startsWith("could not create user: 409")
              .endsWith("User exists with same username");
        });
  }

  @Test
  void getUserById_withEmptyId_failsWithoutRequest() {
    assertThatThrownBy(() -> client.getUserById(TOKEN, REALM, ""))
        .isInstanceOfSatisfying(KeycloakApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(400));

    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void getUserById_decodesUser() throws Exception {
    enqueueJson("{\"id\":\"" + USER_ID + "\",\"username\":\"alice\",\"attributes\":{\"team\":[\"a\"]}}");

    User user = client.getUserById(TOKEN, REALM, USER_ID);

    assertThat(user.username()).isEqualTo("alice");
    assertThat(user.attributes()).containsEntry("team", List.of("a"));
    assertThat(takeRequest().getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID);
  }

  @Test
  void getUsers_sendsOnlySetFilters() throws Exception {
    enqueueJson("[{\"id\":\"1\",\"username\":\"alice\"}]");

    List<User> users = client.getUsers(TOKEN, REALM, GetUsersParams.builder()
        .username("alice")
        .exact(true)
        .max(5)
        .build());

    assertThat(users).extracting(User::username).containsExactly("alice");

    RecordedRequest request = takeRequest();
    assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/admin/realms/test/users");
    assertThat(request.getRequestUrl().queryParameterNames()).containsExactlyInAnyOrder("username", "exact", "max");
    assertThat(request.getRequestUrl().queryParameter("exact")).isEqualTo("true");
    assertThat(request.getRequestUrl().queryParameter("max")).isEqualTo("5");
  }

  @Test
  void getUserCount_parsesBareNumber() throws Exception {
    enqueueJson("17");

    int count = client.getUserCount(TOKEN, REALM, GetUsersParams.builder().enabled(true).build());

    assertThat(count).isEqualTo(17);
    assertThat(takeRequest().getPath()).isEqualTo("/admin/realms/test/users/count?enabled=true");
  }

  @Test
  void getUserCount_withNullBody_throwsKeycloakException() {
    enqueueJson("null");

    assertThatThrownBy(() -> client.getUserCount(TOKEN, REALM, GetUsersParams.empty()))
        .isInstanceOf(KeycloakException.class)
        .hasMessage("could not get user count: empty response body");
  }

  @Test
  void getUsersByRoleName_encodesRoleName() throws Exception {
    enqueueJson("[]");

    List<User> users = client.getUsersByRoleName(TOKEN, REALM, "offline access",
                                                 GetUsersByRoleParams.builder().first(0).max(10).build());

    assertThat(users).isEmpty();
    RecordedRequest request = takeRequest();
    assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/admin/realms/test/roles/offline%20access/users");
    assertThat(request.getRequestUrl().queryParameter("first")).isEqualTo("0");
  }

  @Test
  void getUsersByClientRoleName_usesClientRolePath() throws Exception {
    enqueueJson("[{\"id\":\"u1\"}]");

    List<User> users = client.getUsersByClientRoleName(TOKEN, REALM, "client-uuid", "editor",
                                                       GetUsersByRoleParams.empty());

    assertThat(users).hasSize(1);
    assertThat(takeRequest().getPath()).isEqualTo("/admin/realms/test/clients/client-uuid/roles/editor/users");
  }

  @Test
  void getUserGroups_sendsGroupFilters() throws Exception {
    enqueueJson("[{\"id\":\"g1\",\"name\":\"staff\",\"path\":\"/staff\"}]");

    List<Group> groups = client.getUserGroups(TOKEN, REALM, USER_ID,
                                              GetGroupsParams.builder().briefRepresentation(true).build());

    assertThat(groups).extracting(Group::name).containsExactly("staff");
    assertThat(takeRequest().getPath())
        .isEqualTo("/admin/realms/test/users/" + USER_ID + "/groups?briefRepresentation=true");
  }

  @Test
  void setPassword_putsPasswordCredential() throws Exception {
    enqueueStatus(204);

    client.setPassword(TOKEN, REALM, USER_ID, "s3cret", true);

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("PUT");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/reset-password");
    Credential credential = objectMapper.readValue(request.getBody().readUtf8(), Credential.class);
    assertThat(credential.type()).isEqualTo(Credential.TYPE_PASSWORD);
    assertThat(credential.value()).isEqualTo("s3cret");
    assertThat(credential.temporary()).isTrue();
  }

  @Test
  void updateUser_withoutId_failsWithoutRequest() {
    assertThatThrownBy(() -> client.updateUser(TOKEN, REALM, User.builder().username("alice").build()))
        .isInstanceOf(KeycloakApiException.class)
        .hasMessage("could not update user: user id shall not be empty");

    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void updateUser_putsRepresentation() throws Exception {
    enqueueStatus(204);

    client.updateUser(TOKEN, REALM, User.builder().id(USER_ID).firstName("Alice").build());

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("PUT");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID);
    assertThat(request.getBody().readUtf8()).contains("\"firstName\":\"Alice\"");
  }

  @Test
  void addUserToGroup_putsEmptyBody() throws Exception {
    enqueueStatus(204);

    client.addUserToGroup(TOKEN, REALM, USER_ID, "g1");

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("PUT");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/groups/g1");
    assertThat(request.getBodySize()).isZero();
  }

  @Test
  void deleteUserFromGroup_sendsDelete() throws Exception {
    enqueueStatus(204);

    client.deleteUserFromGroup(TOKEN, REALM, USER_ID, "g1");

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("DELETE");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/groups/g1");
  }

  @Test
  void deleteUser_whenMissing_throwsNotFound() {
    enqueueError(404, "{\"error\":\"User not found\"}");

    assertThatThrownBy(() -> client.deleteUser(TOKEN, REALM, USER_ID))
        .isInstanceOfSatisfying(KeycloakApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(404));
  }

  @Test
  void deleteClientRolesFromUser_sendsRolesInDeleteBody() throws Exception {
    enqueueStatus(204);

    client.deleteClientRolesFromUser(TOKEN, REALM, "client-uuid", USER_ID,
                                     List.of(Role.builder().id("r1").name("viewer").build()));

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("DELETE");
    assertThat(request.getPath())
        .isEqualTo("/admin/realms/test/users/" + USER_ID + "/role-mappings/clients/client-uuid");
    List<Role> roles = objectMapper.readValue(request.getBody().readUtf8(), new TypeReference<>() {});
    assertThat(roles).extracting(Role::name).containsExactly("viewer");
  }

  @Test
  void addClientRolesToUser_postsRoles() throws Exception {
    enqueueStatus(204);

    client.addClientRolesToUser(TOKEN, REALM, "client-uuid", USER_ID, List.of(Role.builder().name("editor").build()));

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getBody().readUtf8()).isEqualTo("[{\"name\":\"editor\"}]");
  }

  @Test
  @SuppressWarnings("deprecation")
  void deprecatedClientRoleAliases_useClientRoleMappingsPath() throws Exception {
    enqueueStatus(204);
    enqueueStatus(204);
    List<Role> roles = List.of(Role.builder().name("viewer").build());

    client.addClientRoleToUser(TOKEN, REALM, "client-uuid", USER_ID, roles);
    client.deleteClientRoleFromUser(TOKEN, REALM, "client-uuid", USER_ID, roles);

    RecordedRequest add = takeRequest();
    assertThat(add.getMethod()).isEqualTo("POST");
    assertThat(add.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/role-mappings/clients/client-uuid");
    assertThat(add.getBody().readUtf8()).isEqualTo("[{\"name\":\"viewer\"}]");
    RecordedRequest delete = takeRequest();
    assertThat(delete.getMethod()).isEqualTo("DELETE");
    assertThat(delete.getPath())
        .isEqualTo("/admin/realms/test/users/" + USER_ID + "/role-mappings/clients/client-uuid");
    assertThat(delete.getBody().readUtf8()).isEqualTo("[{\"name\":\"viewer\"}]");
  }

  @Test
  void getUserSessions_decodesSessions() throws Exception {
    enqueueJson("""
        [{"id":"s1","username":"alice","ipAddress":"10.0.0.1","clients":{"c1":"app"}}]
        """);

    List<UserSession> sessions = client.getUserSessions(TOKEN, REALM, USER_ID);

    assertThat(sessions).hasSize(1);
    assertThat(sessions.get(0).ipAddress()).isEqualTo("10.0.0.1");
    assertThat(takeRequest().getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/sessions");
  }

  @Test
  void getUserOfflineSessionsForClient_usesClientPath() throws Exception {
    enqueueJson("[]");

    client.getUserOfflineSessionsForClient(TOKEN, REALM, USER_ID, "client-uuid");

    assertThat(takeRequest().getPath())
        .isEqualTo("/admin/realms/test/users/" + USER_ID + "/offline-sessions/client-uuid");
  }

  @Test
  void logoutAllSessions_postsToLogout() throws Exception {
    enqueueStatus(204);

    client.logoutAllSessions(TOKEN, REALM, USER_ID);

    RecordedRequest request = takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/logout");
  }

  @Test
  void federatedIdentities_roundTripThroughProviderPath() throws Exception {
    enqueueStatus(204);
    enqueueJson("[{\"identityProvider\":\"github\",\"userId\":\"42\",\"userName\":\"alice\"}]");
    enqueueStatus(204);

    client.createUserFederatedIdentity(TOKEN, REALM, USER_ID, "github",
                                       FederatedIdentity.builder().userId("42").userName("alice").build());
    List<FederatedIdentity> identities = client.getUserFederatedIdentities(TOKEN, REALM, USER_ID);
    client.deleteUserFederatedIdentity(TOKEN, REALM, USER_ID, "github");

    assertThat(identities).extracting(FederatedIdentity::identityProvider).containsExactly("github");

    RecordedRequest create = takeRequest();
    assertThat(create.getMethod()).isEqualTo("POST");
    assertThat(create.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/federated-identity/github");
    assertThat(takeRequest().getMethod()).isEqualTo("GET");
    RecordedRequest delete = takeRequest();
    assertThat(delete.getMethod()).isEqualTo("DELETE");
    assertThat(delete.getPath()).isEqualTo("/admin/realms/test/users/" + USER_ID + "/federated-identity/github");
  }
}
