package com.github.spud.sample.alexa.domain.device;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 智能家居设备（phoenix 拓扑中的 appliance）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SmartHomeDevice {

  private String entityId;
  private String applianceId;

  @JsonAlias("friendlyName")
  private String name;

  @JsonAlias("friendlyDescription")
  private String description;

  @Builder.Default
  @JsonAlias("applianceTypes")
  private List<String> types = new ArrayList<>();

  @JsonProperty("isReachable")
  @JsonAlias("reachable")
  private boolean reachable;
}
