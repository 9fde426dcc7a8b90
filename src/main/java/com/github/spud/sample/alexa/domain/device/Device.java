package com.github.spud.sample.alexa.domain.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Echo 设备
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Device {

  private String accountName;
  private String serialNumber;
  private String deviceType;
  private String deviceFamily;
  private String deviceOwnerCustomerId;
  private boolean online;

  @Builder.Default
  private List<String> capabilities = new ArrayList<>();
}
