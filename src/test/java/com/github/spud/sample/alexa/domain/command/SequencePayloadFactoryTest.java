package com.github.spud.sample.alexa.domain.command;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.util.JsonUtils;
import org.junit.jupiter.api.Test;

/**
 * sequence 负载构造测试
 */
class SequencePayloadFactoryTest {

  private final SequencePayloadFactory factory = new SequencePayloadFactory("en-US");

  private final Device kitchen = Device.builder()
    .accountName("Kitchen Echo")
    .serialNumber("G090LF0994210ABC")
    .deviceType("A4ZP7ZC4PI6TO")
    .deviceOwnerCustomerId("A1CUSTOMER")
    .build();

  @Test
  void speak_carriesExactTextAndSerial() {
    ObjectNode sequence = factory.speak(kitchen, "A1CUSTOMER", "Hello world");

    JsonNode startNode = sequence.path("startNode");
    JsonNode payload = startNode.path("operationPayload");
    assertThat(sequence.path("@type").asText()).isEqualTo(SequencePayloadFactory.SEQUENCE_TYPE);
    assertThat(startNode.path("type").asText()).isEqualTo("Alexa.Speak");
    assertThat(payload.path("textToSpeak").asText()).isEqualTo("Hello world");
    assertThat(payload.path("deviceSerialNumber").asText()).isEqualTo("G090LF0994210ABC");
    assertThat(payload.path("deviceType").asText()).isEqualTo("A4ZP7ZC4PI6TO");
    assertThat(payload.path("customerId").asText()).isEqualTo("A1CUSTOMER");
    assertThat(payload.path("locale").asText()).isEqualTo("en-US");
  }

  @Test
  void specialCharacters_surviveSerialization() {
    String text = "She said \"hi\"\nthen left, 'ok'? café ☕ \\ done";

    String json = JsonUtils.toJson(factory.speak(kitchen, "A1CUSTOMER", text));

    JsonNode reparsed = JsonUtils.readTree(json);
    assertThat(reparsed.path("startNode").path("operationPayload").path("textToSpeak").asText())
      .isEqualTo(text);
    assertThat(reparsed.path("startNode").path("operationPayload").size()).isEqualTo(5);
  }

  @Test
  void sameInputs_produceIdenticalPayload() {
    assertThat(JsonUtils.toJson(factory.textCommand(kitchen, "A1", "what time is it")))
      .isEqualTo(JsonUtils.toJson(factory.textCommand(kitchen, "A1", "what time is it")));
  }

  @Test
  void announce_targetsCustomer() {
    JsonNode payload = factory.announce("A1CUSTOMER", "Dinner is ready")
      .path("startNode").path("operationPayload");

    assertThat(payload.path("expireAfter").asText()).isEqualTo("PT5S");
    assertThat(payload.path("target").path("customerId").asText()).isEqualTo("A1CUSTOMER");
    JsonNode content = payload.path("content").get(0);
    assertThat(content.path("locale").asText()).isEqualTo("en-US");
    assertThat(content.path("display").path("title").asText()).isEqualTo("Announcement");
    assertThat(content.path("display").path("body").asText()).isEqualTo("Dinner is ready");
    assertThat(content.path("speak").path("type").asText()).isEqualTo("text");
    assertThat(content.path("speak").path("value").asText()).isEqualTo("Dinner is ready");
  }

  @Test
  void textCommand_usesTellAlexaSkill() {
    JsonNode startNode = factory.textCommand(kitchen, "A1CUSTOMER", "turn on the lights")
      .path("startNode");

    assertThat(startNode.path("type").asText()).isEqualTo("Alexa.TextCommand");
    assertThat(startNode.path("skillId").asText()).isEqualTo("amzn1.ask.1p.tellalexa");
    assertThat(startNode.path("operationPayload").path("text").asText())
      .isEqualTo("turn on the lights");
  }

  @Test
  void previewRequest_embedsSequenceAsString() {
    String body = JsonUtils.toJson(SequencePayloadFactory.previewRequest("PREVIEW", "{\"a\":1}"));

    assertThat(body).isEqualTo(
      "{\"behaviorId\":\"PREVIEW\",\"sequenceJson\":\"{\\\"a\\\":1}\",\"status\":\"ENABLED\"}");
  }
}
