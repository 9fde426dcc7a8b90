package com.github.spud.sample.alexa.domain.avs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.Locale;
import java.util.UUID;

/**
 * AVS 事件信封：{event: {header, payload}, context: [...]}
 */
public class AvsEventFactory {

  public static final String DIALOG_REQUEST_PREFIX = "Mobile_TTA_";

  private final AvsContextFactory contextFactory;

  public AvsEventFactory(AvsContextFactory contextFactory) {
    this.contextFactory = contextFactory;
  }

  /**
   * Alexa.Input.Text / TextMessage，模拟 App 的 Type-to-Alexa
   */
  public ObjectNode textMessage(String text, String conversationId) {
    ObjectNode envelope = JsonUtils.objectMapper().createObjectNode();
    ObjectNode event = envelope.putObject("event");
    ObjectNode header = event.putObject("header");
    header.put("namespace", "Alexa.Input.Text");
    header.put("name", "TextMessage");
    header.put("messageId", newId());
    header.put("dialogRequestId", DIALOG_REQUEST_PREFIX + newId());
    event.putObject("payload").put("text", text);
    envelope.set("context", contextFactory.build(conversationId));
    return envelope;
  }

  public ObjectNode synchronizeState(String conversationId) {
    ObjectNode envelope = JsonUtils.objectMapper().createObjectNode();
    ObjectNode event = envelope.putObject("event");
    ObjectNode header = event.putObject("header");
    header.put("namespace", "System");
    header.put("name", "SynchronizeState");
    header.put("messageId", newId());
    event.putObject("payload");
    envelope.set("context", contextFactory.build(conversationId));
    return envelope;
  }

  static String newId() {
    return UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
  }
}
