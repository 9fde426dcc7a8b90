package com.github.spud.sample.alexa.domain.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.correlation.PollingPolicy;
import com.github.spud.sample.alexa.domain.error.AuthException;
import com.github.spud.sample.alexa.support.FakeClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * 连接流程：认证后再发命令，全部经由同一会话
 */
class AlexaClientFactoryTest {

  private MockRestServiceServer server;
  private AlexaClientFactory factory;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    AlexaProperties properties = new AlexaProperties();
    properties.setRefreshToken("Atnr|configured");
    properties.setAmazonDomain("amazon.co.uk");
    FakeClock clock = new FakeClock(Instant.parse("2025-01-01T00:00:00Z"));
    factory = new AlexaClientFactory(builder.build(), properties,
      new PollingPolicy(Duration.ofMillis(500), clock, clock.sleeper()));
  }

  @Test
  void connect_authenticatesThenSpeaks() {
    server.expect(requestTo("https://api.amazon.com/ap/exchangetoken/cookies"))
      .andRespond(withSuccess("""
        {"response":{"tokens":{"cookies":{".amazon.co.uk":[
          {"Name":"session-id","Value":"1"}]}}}}
        """, MediaType.APPLICATION_JSON));
    server.expect(requestTo("https://alexa.amazon.co.uk/api/language"))
      .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON)
        .header(HttpHeaders.SET_COOKIE, "csrf=uk-csrf; Path=/"));
    server.expect(requestTo("https://layla.amazon.com/api/devices-v2/device?cached=true"))
      .andRespond(withSuccess("""
        {"devices":[{"accountName":"Office","serialNumber":"S1","deviceType":"T1",
          "deviceOwnerCustomerId":"A1UK"}]}
        """, MediaType.APPLICATION_JSON));
    server.expect(requestTo("https://layla.amazon.com/api/behaviors/preview"))
      .andExpect(jsonPath("$.behaviorId").value("PREVIEW"))
      .andRespond(withSuccess());

    AlexaClient client = factory.connect();
    client.speak("Office", "Hello world");

    server.verify();
    assertThat(client.getSession().getAmazonDomain()).isEqualTo("amazon.co.uk");
    assertThat(client.getSession().getCsrf()).isEqualTo("uk-csrf");
    assertThat(client.getSession().getCustomerId()).isEqualTo("A1UK");
  }

  @Test
  void missingRefreshToken_throwsAuthException() {
    assertThatThrownBy(() -> factory.connect("", "amazon.com"))
      .isInstanceOf(AuthException.class);
  }

  @Test
  void create_doesNotTouchNetwork() {
    AlexaClient client = factory.create("Atnr|x", null);
    client.setConversationId("amzn1.conversation.1");

    assertThat(client.getSession().getAmazonDomain()).isEqualTo("amazon.co.uk");
    assertThat(client.getSession().getConversationId()).isEqualTo("amzn1.conversation.1");
    server.verify();
  }
}
