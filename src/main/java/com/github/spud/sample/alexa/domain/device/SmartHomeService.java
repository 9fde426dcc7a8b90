package com.github.spud.sample.alexa.domain.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.domain.error.NotFoundException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * 智能家居拓扑查询与状态控制
 */
@Slf4j
public class SmartHomeService {

  private final AlexaTransport transport;

  public SmartHomeService(AlexaTransport transport) {
    this.transport = transport;
  }

  public List<SmartHomeDevice> getSmartHomeDevices(AlexaSession session) {
    String body = transport.request(session, HttpMethod.GET, "/api/phoenix", null);
    JsonNode root = JsonUtils.readBody(body, "smart home");

    List<SmartHomeDevice> devices = new ArrayList<>();
    for (JsonNode network : root.path("networkDetail")) {
      for (JsonNode appliance : network.path("applianceDetails")) {
        devices.add(JsonUtils.objectMapper().convertValue(appliance, SmartHomeDevice.class));
      }
    }
    log.debug("Fetched {} smart home devices", devices.size());
    return devices;
  }

  /**
   * 按名称查找：先不区分大小写的精确匹配，再子串匹配
   */
  public SmartHomeDevice findSmartHomeDevice(AlexaSession session, String name) {
    List<SmartHomeDevice> devices = getSmartHomeDevices(session);
    String needle = name.toLowerCase(Locale.ROOT);
    for (SmartHomeDevice device : devices) {
      if (device.getName() != null && device.getName().toLowerCase(Locale.ROOT).equals(needle)) {
        return device;
      }
    }
    for (SmartHomeDevice device : devices) {
      if (device.getName() != null
        && device.getName().toLowerCase(Locale.ROOT).contains(needle)) {
        return device;
      }
    }
    throw new NotFoundException("Smart home device '" + name + "' not found");
  }

  /**
   * 控制设备状态，brightness 仅用于 {@link SmartHomeAction#SET_BRIGHTNESS}
   */
  public void control(AlexaSession session, String entityId, SmartHomeAction action,
    Integer brightness) {
    ObjectNode parameters = JsonUtils.objectMapper().createObjectNode();
    parameters.put("action", action.getWireName());
    if (action == SmartHomeAction.SET_BRIGHTNESS) {
      if (brightness == null || brightness < 0 || brightness > 100) {
        throw new IllegalArgumentException("Brightness must be 0-100");
      }
      parameters.put("brightness", brightness);
    }

    ObjectNode request = JsonUtils.objectMapper().createObjectNode();
    request.put("entityId", entityId);
    request.put("entityType", "APPLIANCE");
    request.set("parameters", parameters);

    ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
    ArrayNode controlRequests = payload.putArray("controlRequests");
    controlRequests.add(request);

    transport.request(session, HttpMethod.PUT, "/api/phoenix/state", payload);
    log.info("Smart home {} sent to {}", action, entityId);
  }
}
