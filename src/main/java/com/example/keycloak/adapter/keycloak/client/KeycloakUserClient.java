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
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.List;

/**
 * User administration within a realm.
 */
@RequiredArgsConstructor
public class KeycloakUserClient {

  private static final TypeReference<List<User>> USER_LIST = new TypeReference<>() {};
  private static final TypeReference<List<Group>> GROUP_LIST = new TypeReference<>() {};
  private static final TypeReference<List<UserSession>> SESSION_LIST = new TypeReference<>() {};
  private static final TypeReference<List<FederatedIdentity>> FEDERATED_IDENTITY_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  /**
   * Creates the user and returns its id.
   * Realm roles and groups in the representation are ignored by the server; attach them with
   * follow-up calls.
   */
  public String createUser(String token, String realm, User user) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users"))
        .post(executor.json(user))
        .build();

    return executor.create(request, "could not create user");
  }

  public void deleteUser(String token, String realm, String userId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId))
        .delete()
        .build();

    executor.send(request, "could not delete user");
  }

  public User getUserById(String token, String realm, String userId) {
    final String errMessage = "could not get user by id";
    KeycloakRequestExecutor.requireNonEmpty(userId, "userID", errMessage);

    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId))
        .get()
        .build();

    return executor.fetch(request, errMessage, User.class);
  }

  public int getUserCount(String token, String realm, GetUsersParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "users", "count"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get user count", Integer.class);
  }

  public List<Group> getUserGroups(String token, String realm, String userId, GetGroupsParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "users", userId, "groups"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get user groups", GROUP_LIST);
  }

  public List<User> getUsers(String token, String realm, GetUsersParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "users"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get users", USER_LIST);
  }

  /**
   * Users holding the given realm role directly.
   */
  public List<User> getUsersByRoleName(String token, String realm, String roleName, GetUsersByRoleParams params) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles", roleName, "users");
    return fetchUsers(token, executor.withQuery(url, params), "could not get users by role name");
  }

  public List<User> getUsersByClientRoleName(String token, String realm, String idOfClient, String roleName,
                                             GetUsersByRoleParams params) {
    HttpUrl url = executor.adminRealmUrl(realm, "clients", idOfClient, "roles", roleName, "users");
    return fetchUsers(token, executor.withQuery(url, params), "could not get users by client role name");
  }

  private List<User> fetchUsers(String token, HttpUrl url, String errMessage) {
    Request request = executor.bearerRequest(token)
        .url(url)
        .get()
        .build();

    return executor.fetch(request, errMessage, USER_LIST);
  }

  /**
   * Resets the password. A temporary password must be changed at the next login.
   */
  public void setPassword(String token, String realm, String userId, String password, boolean temporary) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "reset-password"))
        .put(executor.json(Credential.password(password, temporary)))
        .build();

    executor.send(request, "could not set password");
  }

  /**
   * Updates the user identified by {@code user.id()}.
   */
  public void updateUser(String token, String realm, User user) {
    final String errMessage = "could not update user";
    KeycloakRequestExecutor.requireNonEmpty(user.id(), "user id", errMessage);

    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", user.id()))
        .put(executor.json(user))
        .build();

    executor.send(request, errMessage);
  }

  public void addUserToGroup(String token, String realm, String userId, String groupId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "groups", groupId))
        .put(RequestBody.create(new byte[0]))
        .build();

    executor.send(request, "could not add user to group");
  }

  public void deleteUserFromGroup(String token, String realm, String userId, String groupId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "groups", groupId))
        .delete()
        .build();

    executor.send(request, "could not delete user from group");
  }

  public List<UserSession> getUserSessions(String token, String realm, String userId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "sessions"))
        .get()
        .build();

    return executor.fetch(request, "could not get user sessions", SESSION_LIST);
  }

  public List<UserSession> getUserOfflineSessionsForClient(String token, String realm, String userId,
                                                           String idOfClient) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "offline-sessions", idOfClient))
        .get()
        .build();

    return executor.fetch(request, "could not get user offline sessions for client", SESSION_LIST);
  }

  /**
   * Removes every session of the user, effectively logging them out everywhere.
   */
  public void logoutAllSessions(String token, String realm, String userId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "logout"))
        .post(RequestBody.create(new byte[0]))
        .build();

    executor.send(request, "could not logout");
  }

  // --- Client role mappings ---

  public void addClientRolesToUser(String token, String realm, String idOfClient, String userId, List<Role> roles) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "role-mappings", "clients", idOfClient))
        .post(executor.json(roles))
        .build();

    executor.send(request, "could not add client role to user");
  }

  /**
   * @deprecated use {@link #addClientRolesToUser(String, String, String, String, List)}
   */
  @Deprecated
  public void addClientRoleToUser(String token, String realm, String idOfClient, String userId, List<Role> roles) {
    addClientRolesToUser(token, realm, idOfClient, userId, roles);
  }

  public void deleteClientRolesFromUser(String token, String realm, String idOfClient, String userId,
                                        List<Role> roles) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "role-mappings", "clients", idOfClient))
        .delete(executor.json(roles))
        .build();

    executor.send(request, "could not delete client role from user");
  }

  /**
   * @deprecated use {@link #deleteClientRolesFromUser(String, String, String, String, List)}
   */
  @Deprecated
  public void deleteClientRoleFromUser(String token, String realm, String idOfClient, String userId,
                                       List<Role> roles) {
    deleteClientRolesFromUser(token, realm, idOfClient, userId, roles);
  }

  // --- Federated identities ---

  public List<FederatedIdentity> getUserFederatedIdentities(String token, String realm, String userId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "federated-identity"))
        .get()
        .build();

    return executor.fetch(request, "could not get user federated identities", FEDERATED_IDENTITY_LIST);
  }

  public void createUserFederatedIdentity(String token, String realm, String userId, String providerId,
                                          FederatedIdentity federatedIdentity) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "federated-identity", providerId))
        .post(executor.json(federatedIdentity))
        .build();

    executor.send(request, "could not create user federated identity");
  }

  public void deleteUserFederatedIdentity(String token, String realm, String userId, String providerId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "users", userId, "federated-identity", providerId))
        .delete()
        .build();

    executor.send(request, "could not delete user federated identity");
  }
}
