package com.github.spud.sample.alexa.domain.transport;

import static com.github.spud.sample.alexa.support.AlexaMockSupport.API;
import static com.github.spud.sample.alexa.support.AlexaMockSupport.AVS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.TransportException;
import com.github.spud.sample.alexa.support.AlexaMockSupport;
import java.io.IOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;

class AlexaTransportTest {

  private MockRestServiceServer server;
  private AlexaTransport transport;

  @BeforeEach
  void setUp() {
    AlexaMockSupport support = new AlexaMockSupport();
    server = support.getServer();
    transport = support.getTransport();
  }

  @Test
  void ioFailure_becomesTransportException() {
    server.expect(requestTo(API + "/api/phoenix"))
      .andRespond(withException(new IOException("connection reset")));

    assertThatThrownBy(() -> transport.request(AlexaMockSupport.authenticatedSession(),
      HttpMethod.GET, "/api/phoenix", null))
      .isInstanceOf(TransportException.class)
      .hasMessageContaining("/api/phoenix")
      .hasCauseInstanceOf(ResourceAccessException.class);
  }

  @Test
  void rawExchangeTimeout_becomesTransportException() {
    server.expect(requestTo(AVS + "/v20160207/events"))
      .andRespond(withException(new SocketTimeoutException("Read timed out")));

    assertThatThrownBy(() -> transport.postMultipart(AVS + "/v20160207/events", "B1", "body",
      null))
      .isInstanceOf(TransportException.class);
  }

  @Test
  void errorStatus_staysBackendException() {
    server.expect(requestTo(API + "/api/phoenix"))
      .andExpect(header(HttpHeaders.COOKIE, AlexaMockSupport.COOKIES))
      .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("busy"));

    assertThatThrownBy(() -> transport.request(AlexaMockSupport.authenticatedSession(),
      HttpMethod.GET, "/api/phoenix", null))
      .isInstanceOfSatisfying(BackendException.class, e -> {
        assertThat(e.getStatus()).isEqualTo(503);
        assertThat(e.getBody()).isEqualTo("busy");
      });
  }

  @Test
  void rawGet_returnsErrorStatusWithoutThrowing() {
    server.expect(requestTo(API + "/anything"))
      .andRespond(withStatus(HttpStatus.FORBIDDEN).body("denied"));

    RawResponse response = transport.get(API + "/anything", null);

    assertThat(response.isError()).isTrue();
    assertThat(response.getStatus()).isEqualTo(403);
    assertThat(response.getBody()).isEqualTo("denied");
  }
}
