package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Role;
import com.example.keycloak.adapter.keycloak.request.GetRoleParams;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.util.List;

/**
 * Realm roles, their composites and their mappings to users and groups, plus the client role
 * operations needed to manage client level access.
 */
@RequiredArgsConstructor
public class KeycloakRoleClient {

  private static final TypeReference<List<Role>> ROLE_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  // --- Realm roles ---

  /**
   * Creates a realm role. Keycloak answers with the role name as the last {@code Location} segment.
   */
  public String createRealmRole(String token, String realm, Role role) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "roles"))
        .post(executor.json(role))
        .build();

    return executor.create(request, "could not create realm role");
  }

  public Role getRealmRole(String token, String realm, String roleName) {
    return fetchRole(token, executor.adminRealmUrl(realm, "roles", roleName), "could not get realm role");
  }

  public Role getRealmRoleById(String token, String realm, String roleId) {
    return fetchRole(token, executor.adminRealmUrl(realm, "roles-by-id", roleId), "could not get realm role");
  }

  public List<Role> getRealmRoles(String token, String realm, GetRoleParams params) {
    HttpUrl url = executor.withQuery(executor.adminRealmUrl(realm, "roles"), params);
    return fetchRoles(token, url, "could not get realm roles");
  }

  /**
   * Realm roles mapped directly to the user, without the effective roles of composites.
   */
  public List<Role> getRealmRolesByUserId(String token, String realm, String userId) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "realm");
    return fetchRoles(token, url, "could not get realm roles by user id");
  }

  public List<Role> getRealmRolesByGroupId(String token, String realm, String groupId) {
    HttpUrl url = executor.adminRealmUrl(realm, "groups", groupId, "role-mappings", "realm");
    return fetchRoles(token, url, "could not get realm roles by group id");
  }

  public void updateRealmRole(String token, String realm, String roleName, Role role) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "roles", roleName))
        .put(executor.json(role))
        .build();

    executor.send(request, "could not update realm role");
  }

  public void updateRealmRoleById(String token, String realm, String roleId, Role role) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "roles-by-id", roleId))
        .put(executor.json(role))
        .build();

    executor.send(request, "could not update realm role");
  }

  public void deleteRealmRole(String token, String realm, String roleName) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "roles", roleName))
        .delete()
        .build();

    executor.send(request, "could not delete realm role");
  }

  // --- Realm role mappings ---

  public void addRealmRoleToUser(String token, String realm, String userId, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "realm");
    sendRoles(token, url, roles, false, "could not add realm role to user");
  }

  public void deleteRealmRoleFromUser(String token, String realm, String userId, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "realm");
    sendRoles(token, url, roles, true, "could not delete realm role from user");
  }

  public void addRealmRoleToGroup(String token, String realm, String groupId, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "groups", groupId, "role-mappings", "realm");
    sendRoles(token, url, roles, false, "could not add realm role to group");
  }

  public void deleteRealmRoleFromGroup(String token, String realm, String groupId, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "groups", groupId, "role-mappings", "realm");
    sendRoles(token, url, roles, true, "could not delete realm role from group");
  }

  // --- Composites ---

  public void addRealmRoleComposite(String token, String realm, String roleName, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles", roleName, "composites");
    sendRoles(token, url, roles, false, "could not add realm role composite");
  }

  public void deleteRealmRoleComposite(String token, String realm, String roleName, List<Role> roles) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles", roleName, "composites");
    sendRoles(token, url, roles, true, "could not delete realm role composite");
  }

  public List<Role> getCompositeRealmRoles(String token, String realm, String roleName) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles", roleName, "composites");
    return fetchRoles(token, url, "could not get composite realm roles by role");
  }

  /**
   * Realm and client roles a composite role, identified by id, is made of.
   */
  public List<Role> getCompositeRolesByRoleId(String token, String realm, String roleId) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles-by-id", roleId, "composites");
    return fetchRoles(token, url, "could not get composite client roles by role id");
  }

  public List<Role> getCompositeRealmRolesByRoleId(String token, String realm, String roleId) {
    HttpUrl url = executor.adminRealmUrl(realm, "roles-by-id", roleId, "composites", "realm");
    return fetchRoles(token, url, "could not get composite client roles by role id");
  }

  /**
   * Effective realm roles of the user: direct mappings, group mappings and expanded composites.
   */
  public List<Role> getCompositeRealmRolesByUserId(String token, String realm, String userId) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "realm", "composite");
    return fetchRoles(token, url, "could not get composite client roles by user id");
  }

  public List<Role> getCompositeRealmRolesByGroupId(String token, String realm, String groupId) {
    HttpUrl url = executor.adminRealmUrl(realm, "groups", groupId, "role-mappings", "realm", "composite");
    return fetchRoles(token, url, "could not get composite client roles by group id");
  }

  /**
   * Realm roles that could still be mapped to the user.
   */
  public List<Role> getAvailableRealmRolesByUserId(String token, String realm, String userId) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "realm", "available");
    return fetchRoles(token, url, "could not get available client roles by user id");
  }

  public List<Role> getAvailableRealmRolesByGroupId(String token, String realm, String groupId) {
    HttpUrl url = executor.adminRealmUrl(realm, "groups", groupId, "role-mappings", "realm", "available");
    return fetchRoles(token, url, "could not get available client roles by group id");
  }

  // --- Client roles ---

  /**
   * Creates a role on the client with internal id {@code idOfClient} and returns its name.
   */
  public String createClientRole(String token, String realm, String idOfClient, Role role) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "clients", idOfClient, "roles"))
        .post(executor.json(role))
        .build();

    return executor.create(request, "could not create client role");
  }

  public Role getClientRole(String token, String realm, String idOfClient, String roleName) {
    HttpUrl url = executor.adminRealmUrl(realm, "clients", idOfClient, "roles", roleName);
    return fetchRole(token, url, "could not get client role");
  }

  public List<Role> getClientRoles(String token, String realm, String idOfClient, GetRoleParams params) {
    HttpUrl url = executor.withQuery(executor.adminRealmUrl(realm, "clients", idOfClient, "roles"), params);
    return fetchRoles(token, url, "could not get client roles");
  }

  public void deleteClientRole(String token, String realm, String idOfClient, String roleName) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "clients", idOfClient, "roles", roleName))
        .delete()
        .build();

    executor.send(request, "could not delete client role");
  }

  public List<Role> getClientRolesByUserId(String token, String realm, String idOfClient, String userId) {
    HttpUrl url = executor.adminRealmUrl(realm, "users", userId, "role-mappings", "clients", idOfClient);
    return fetchRoles(token, url, "could not get client roles by user id");
  }

  private Role fetchRole(String token, HttpUrl url, String errMessage) {
    Request request = executor.bearerRequest(token)
        .url(url)
        .get()
        .build();

    return executor.fetch(request, errMessage, Role.class);
  }

  private List<Role> fetchRoles(String token, HttpUrl url, String errMessage) {
    Request request = executor.bearerRequest(token)
        .url(url)
        .get()
        .build();

    return executor.fetch(request, errMessage, ROLE_LIST);
  }

  private void sendRoles(String token, HttpUrl url, List<Role> roles, boolean delete, String errMessage) {
    Request.Builder builder = executor.bearerRequest(token).url(url);
    if (delete) {
      builder.delete(executor.json(roles));
    } else {
      builder.post(executor.json(roles));
    }

    executor.send(builder.build(), errMessage);
  }
}
