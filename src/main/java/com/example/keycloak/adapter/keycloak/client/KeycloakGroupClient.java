package com.example.keycloak.adapter.keycloak.client;

import com.example.keycloak.adapter.keycloak.dto.Group;
import com.example.keycloak.adapter.keycloak.dto.User;
import com.example.keycloak.adapter.keycloak.request.GetGroupsParams;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import okhttp3.Request;

import java.util.List;

/**
 * Group administration within a realm.
 */
@RequiredArgsConstructor
public class KeycloakGroupClient {

  private static final TypeReference<List<Group>> GROUP_LIST = new TypeReference<>() {};
  private static final TypeReference<List<User>> USER_LIST = new TypeReference<>() {};

  private final KeycloakRequestExecutor executor;

  /**
   * Creates a top level group and returns its id.
   */
  public String createGroup(String token, String realm, Group group) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "groups"))
        .post(executor.json(group))
        .build();

    return executor.create(request, "could not create group");
  }

  /**
   * Creates a sub-group of {@code parentGroupId} and returns its id.
   */
  public String createChildGroup(String token, String realm, String parentGroupId, Group group) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "groups", parentGroupId, "children"))
        .post(executor.json(group))
        .build();

    return executor.create(request, "could not create child group");
  }

  public Group getGroup(String token, String realm, String groupId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "groups", groupId))
        .get()
        .build();

    return executor.fetch(request, "could not get group", Group.class);
  }

  public List<Group> getGroups(String token, String realm, GetGroupsParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "groups"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get groups", GROUP_LIST);
  }

  public int getGroupsCount(String token, String realm, GetGroupsParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "groups", "count"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get groups count", GroupsCount.class).count();
  }

  /**
   * Updates the group identified by {@code group.id()}.
   */
  public void updateGroup(String token, String realm, Group group) {
    final String errMessage = "could not update group";
    KeycloakRequestExecutor.requireNonEmpty(group.id(), "group id", errMessage);

    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "groups", group.id()))
        .put(executor.json(group))
        .build();

    executor.send(request, errMessage);
  }

  /**
   * Deletes the group together with all of its sub-groups.
   */
  public void deleteGroup(String token, String realm, String groupId) {
    Request request = executor.bearerRequest(token)
        .url(executor.adminRealmUrl(realm, "groups", groupId))
        .delete()
        .build();

    executor.send(request, "could not delete group");
  }

  public List<User> getGroupMembers(String token, String realm, String groupId, GetGroupsParams params) {
    Request request = executor.bearerRequest(token)
        .url(executor.withQuery(executor.adminRealmUrl(realm, "groups", groupId, "members"), params))
        .get()
        .build();

    return executor.fetch(request, "could not get group members", USER_LIST);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GroupsCount(int count) {}
}
