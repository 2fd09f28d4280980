package com.example.keycloak.adapter.keycloak.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Admin server info, reduced to the system and memory sections.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerInfo(
    SystemInfo systemInfo,
    MemoryInfo memoryInfo
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SystemInfo(
      String version,
      String serverTime,
      String uptime,
      Long uptimeMillis,
      String javaVersion,
      String javaVendor,
      String osName,
      String osVersion
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record MemoryInfo(
      Long used,
      Long free,
      Long total,
      Long max,
      Long usedPercentage
  ) {}
}
