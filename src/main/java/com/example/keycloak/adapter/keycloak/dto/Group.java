package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    String id,
    String name,
    String path,
    String parentId,
    Long subGroupCount,
    List<Group> subGroups,
    Map<String, List<String>> attributes,
    Map<String, Boolean> access,
    Map<String, List<String>> clientRoles,
    List<String> realmRoles
) {}
