package com.github.spud.sample.alexa.domain.command;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 构造 behaviors/preview 所需的 sequence JSON。文本一律经 Jackson 转义。
 */
public class SequencePayloadFactory {

  static final String SEQUENCE_TYPE = "com.amazon.alexa.behaviors.model.Sequence";
  static final String OPAQUE_NODE_TYPE =
    "com.amazon.alexa.behaviors.model.OpaquePayloadOperationNode";
  static final String TELL_ALEXA_SKILL = "amzn1.ask.1p.tellalexa";
  static final String ANNOUNCEMENT_EXPIRY = "PT5S";

  public static final String PREVIEW_BEHAVIOR_ID = "PREVIEW";
  public static final String STATUS_ENABLED = "ENABLED";

  private final String locale;

  public SequencePayloadFactory(String locale) {
    this.locale = locale;
  }

  public ObjectNode speak(Device device, String customerId, String text) {
    ObjectNode operation = JsonUtils.objectMapper().createObjectNode();
    operation.put("deviceType", device.getDeviceType());
    operation.put("deviceSerialNumber", device.getSerialNumber());
    operation.put("customerId", customerId);
    operation.put("locale", locale);
    operation.put("textToSpeak", text);
    return sequence("Alexa.Speak", null, operation);
  }

  public ObjectNode announce(String customerId, String text) {
    ObjectNode operation = JsonUtils.objectMapper().createObjectNode();
    operation.put("expireAfter", ANNOUNCEMENT_EXPIRY);

    ObjectNode content = operation.putArray("content").addObject();
    content.put("locale", locale);
    ObjectNode display = content.putObject("display");
    display.put("title", "Announcement");
    display.put("body", text);
    ObjectNode speak = content.putObject("speak");
    speak.put("type", "text");
    speak.put("value", text);

    operation.putObject("target").put("customerId", customerId);
    return sequence("AlexaAnnouncement", null, operation);
  }

  public ObjectNode textCommand(Device device, String customerId, String text) {
    ObjectNode operation = JsonUtils.objectMapper().createObjectNode();
    operation.put("deviceType", device.getDeviceType());
    operation.put("deviceSerialNumber", device.getSerialNumber());
    operation.put("customerId", customerId);
    operation.put("text", text);
    return sequence("Alexa.TextCommand", TELL_ALEXA_SKILL, operation);
  }

  /**
   * behaviors/preview 请求体，sequenceJson 字段是内嵌的 JSON 字符串
   */
  public static Map<String, Object> previewRequest(String behaviorId, String sequenceJson) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("behaviorId", behaviorId);
    payload.put("sequenceJson", sequenceJson);
    payload.put("status", STATUS_ENABLED);
    return payload;
  }

  private ObjectNode sequence(String operationType, String skillId, ObjectNode operationPayload) {
    ObjectNode root = JsonUtils.objectMapper().createObjectNode();
    root.put("@type", SEQUENCE_TYPE);
    ObjectNode startNode = root.putObject("startNode");
    startNode.put("@type", OPAQUE_NODE_TYPE);
    startNode.put("type", operationType);
    if (skillId != null) {
      startNode.put("skillId", skillId);
    }
    startNode.set("operationPayload", operationPayload);
    return root;
  }
}
