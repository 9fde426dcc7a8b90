package com.github.spud.sample.alexa.domain.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.spud.sample.alexa.domain.error.NotFoundException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;

/**
 * 设备列表。每次调用都重新拉取，不做跨调用缓存。
 */
@Slf4j
public class DeviceService {

  private final AlexaTransport transport;

  public DeviceService(AlexaTransport transport) {
    this.transport = transport;
  }

  /**
   * 列出所有设备，并以第一台设备记录客户 ID
   */
  public List<Device> getDevices(AlexaSession session) {
    String body = transport.request(session, HttpMethod.GET,
      "/api/devices-v2/device?cached=true", null);
    DevicesResponse response = JsonUtils.readBody(body, DevicesResponse.class, "devices");
    List<Device> devices = response.getDevices() != null ? response.getDevices() : List.of();

    if (!devices.isEmpty() && StringUtils.hasText(devices.get(0).getDeviceOwnerCustomerId())) {
      session.setCustomerId(devices.get(0).getDeviceOwnerCustomerId());
    }
    log.debug("Fetched {} devices", devices.size());
    return devices;
  }

  /**
   * 按序列号或名称查找：先精确匹配，再不区分大小写的子串匹配
   */
  public Device findDevice(AlexaSession session, String nameOrSerial) {
    List<Device> devices = getDevices(session);
    for (Device device : devices) {
      if (nameOrSerial.equals(device.getSerialNumber())
        || nameOrSerial.equals(device.getAccountName())) {
        return device;
      }
    }
    String needle = nameOrSerial.toLowerCase(Locale.ROOT);
    for (Device device : devices) {
      if (device.getAccountName() != null
        && device.getAccountName().toLowerCase(Locale.ROOT).contains(needle)) {
        return device;
      }
    }
    throw new NotFoundException("Device '" + nameOrSerial + "' not found");
  }

  /**
   * 第一台设备，用于不需要指定目标的命令（广播、例程）
   */
  public Device firstDevice(AlexaSession session) {
    List<Device> devices = getDevices(session);
    if (devices.isEmpty()) {
      throw new NotFoundException("No devices found");
    }
    return devices.get(0);
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class DevicesResponse {

    private List<Device> devices = new ArrayList<>();
  }
}
