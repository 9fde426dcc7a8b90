package com.github.spud.sample.alexa.domain.command;

import static com.github.spud.sample.alexa.support.AlexaMockSupport.ALEXA;
import static com.github.spud.sample.alexa.support.AlexaMockSupport.API;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.routine.RoutineService;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.support.AlexaMockSupport;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;

class CommandDispatcherTest {

  private MockRestServiceServer server;
  private CommandDispatcher dispatcher;
  private AlexaSession session;

  private final Device echo = Device.builder()
    .accountName("Echo Dot")
    .serialNumber("G090LF0994210ABC")
    .deviceType("A3S5BH2HU6VAYF")
    .deviceOwnerCustomerId("A1OWNER")
    .build();

  @BeforeEach
  void setUp() {
    AlexaMockSupport support = new AlexaMockSupport();
    server = support.getServer();
    dispatcher = new CommandDispatcher(support.getTransport(), new SequencePayloadFactory("en-US"),
      new RoutineService(support.getTransport()));
    session = AlexaMockSupport.authenticatedSession();
  }

  @Test
  void speak_postsPreviewWithEmbeddedSequence() {
    AtomicReference<String> body = new AtomicReference<>();
    server.expect(requestTo(API + "/api/behaviors/preview"))
      .andExpect(method(HttpMethod.POST))
      .andExpect(header("csrf", "abc123"))
      .andExpect(jsonPath("$.behaviorId").value("PREVIEW"))
      .andExpect(jsonPath("$.status").value("ENABLED"))
      .andExpect(request -> body.set(((MockClientHttpRequest) request).getBodyAsString()))
      .andRespond(withSuccess());

    dispatcher.dispatch(session, Command.speak(echo, "Hello world"));

    server.verify();
    JsonNode sequence = JsonUtils.readTree(
      JsonUtils.readTree(body.get()).path("sequenceJson").asText());
    JsonNode payload = sequence.path("startNode").path("operationPayload");
    assertThat(payload.path("textToSpeak").asText()).isEqualTo("Hello world");
    assertThat(payload.path("deviceSerialNumber").asText()).isEqualTo("G090LF0994210ABC");
  }

  @Test
  void customerIdDefaultsFromDevice() {
    server.expect(requestTo(API + "/api/behaviors/preview")).andRespond(withSuccess());

    dispatcher.dispatch(session, Command.textCommand(echo, "what time is it"));

    assertThat(session.getCustomerId()).isEqualTo("A1OWNER");
  }

  @Test
  void knownCustomerIdIsKept() {
    session.setCustomerId("A9KNOWN");
    AtomicReference<String> body = new AtomicReference<>();
    server.expect(requestTo(API + "/api/behaviors/preview"))
      .andExpect(request -> body.set(((MockClientHttpRequest) request).getBodyAsString()))
      .andRespond(withSuccess());

    dispatcher.dispatch(session, Command.announce(echo, "Dinner"));

    JsonNode sequence = JsonUtils.readTree(
      JsonUtils.readTree(body.get()).path("sequenceJson").asText());
    assertThat(sequence.path("startNode").path("operationPayload").path("target")
      .path("customerId").asText()).isEqualTo("A9KNOWN");
  }

  @Test
  void automation_runsRoutineByName() {
    server.expect(requestTo(ALEXA + "/api/behaviors/automations"))
      .andRespond(withSuccess(
        "[{\"automationId\":\"amzn1.alexa.automation.1\",\"name\":\"Good Night\","
          + "\"sequence\":{\"@type\":\"seq\"}}]", MediaType.APPLICATION_JSON));
    server.expect(requestTo(API + "/api/behaviors/preview"))
      .andExpect(jsonPath("$.behaviorId").value("amzn1.alexa.automation.1"))
      .andExpect(jsonPath("$.sequenceJson").value("{\"@type\":\"seq\"}"))
      .andRespond(withSuccess());

    dispatcher.dispatch(session, Command.automation(null, "good night"));

    server.verify();
  }

  @Test
  void backendRejection_surfacesStatus() {
    server.expect(requestTo(API + "/api/behaviors/preview"))
      .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("expired"));

    assertThatThrownBy(() -> dispatcher.dispatch(session, Command.speak(echo, "hi")))
      .isInstanceOf(BackendException.class)
      .hasMessageContaining("401");
  }
}
