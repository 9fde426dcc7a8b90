package com.github.spud.sample.alexa.domain.session;

import static com.github.spud.sample.alexa.support.AlexaMockSupport.ALEXA;
import static com.github.spud.sample.alexa.support.AlexaMockSupport.IDENTITY;
import static com.github.spud.sample.alexa.support.AlexaMockSupport.PRIVACY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.github.spud.sample.alexa.domain.error.AuthException;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.ProtocolException;
import com.github.spud.sample.alexa.support.AlexaMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

/**
 * 凭据获取流程测试
 */
class SessionManagerTest {

  private static final String EXCHANGE_URL = IDENTITY + "/ap/exchangetoken/cookies";

  private static final String TWO_COOKIES = """
    {
      "response": {
        "tokens": {
          "cookies": {
            ".amazon.com": [
              {"Name": "session-id", "Value": "123-456"},
              {"Name": "ubid-main", "Value": "789"}
            ]
          }
        }
      }
    }
    """;

  private MockRestServiceServer server;
  private SessionManager sessionManager;
  private AlexaSession session;

  @BeforeEach
  void setUp() {
    AlexaMockSupport support = new AlexaMockSupport();
    server = support.getServer();
    sessionManager = new SessionManager(support.getTransport(), support.getProperties());
    session = new AlexaSession("Atnr|refresh", "amazon.com");
  }

  @Test
  void cookiesThenCsrf_succeeds() {
    server.expect(requestTo(EXCHANGE_URL))
      .andExpect(method(HttpMethod.POST))
      .andExpect(header("x-amzn-identity-auth-domain", "api.amazon.com"))
      .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
      .andRespond(withSuccess(TWO_COOKIES, MediaType.APPLICATION_JSON));
    server.expect(requestTo(ALEXA + "/api/language"))
      .andExpect(method(HttpMethod.GET))
      .andExpect(header(HttpHeaders.COOKIE, "session-id=123-456; ubid-main=789"))
      .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON)
        .header(HttpHeaders.SET_COOKIE, "csrf=987654; Path=/; Secure"));

    sessionManager.ensureCookies(session);
    sessionManager.ensureCsrf(session);

    assertThat(session.getCsrf()).isEqualTo("987654");
    assertThat(session.getCookies()).isEqualTo("session-id=123-456; ubid-main=789; csrf=987654");
    server.verify();
  }

  @Test
  void zeroCookies_throwsAuthException() {
    server.expect(requestTo(EXCHANGE_URL))
      .andRespond(withSuccess("{\"response\":{\"tokens\":{\"cookies\":{}}}}",
        MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> sessionManager.ensureCookies(session))
      .isInstanceOf(AuthException.class)
      .hasMessageContaining("No cookies");
    assertThat(session.hasCookies()).isFalse();
  }

  @Test
  void exchangeRejected_throwsAuthException() {
    server.expect(requestTo(EXCHANGE_URL))
      .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"error\":\"invalid_grant\"}"));

    assertThatThrownBy(() -> sessionManager.ensureCookies(session))
      .isInstanceOf(AuthException.class)
      .hasMessageContaining("400");
  }

  @Test
  void ensureCookies_isNoOpWhenAlreadyPresent() {
    session.setCookies("a=b");

    sessionManager.ensureCookies(session);

    server.verify();
    assertThat(session.getCookies()).isEqualTo("a=b");
  }

  @Test
  void csrf_fallsBackToExistingCookie() {
    session.setCookies("session-id=1; csrf=from-blob");
    server.expect(requestTo(ALEXA + "/api/language"))
      .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    sessionManager.ensureCsrf(session);

    assertThat(session.getCsrf()).isEqualTo("from-blob");
  }

  @Test
  void csrf_missingEverywhere_throwsAuthException() {
    session.setCookies("session-id=1");
    server.expect(requestTo(ALEXA + "/api/language"))
      .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> sessionManager.ensureCsrf(session))
      .isInstanceOf(AuthException.class)
      .hasMessage("CSRF token not found");
  }

  @Test
  void csrf_withoutCookies_throwsAuthException() {
    assertThatThrownBy(() -> sessionManager.ensureCsrf(session))
      .isInstanceOf(AuthException.class);
  }

  @Test
  void activityCsrf_extractedFromPage() {
    session.setCookies("session-id=1");
    server.expect(requestTo(PRIVACY + "/alexa-privacy/apd/activity?ref=activityHistory"))
      .andExpect(header(HttpHeaders.COOKIE, "session-id=1"))
      .andRespond(withSuccess("<html><meta name=\"csrf-token\" content=\"act-1\"></html>",
        MediaType.TEXT_HTML));

    sessionManager.ensureActivityCsrf(session);

    assertThat(session.getActivityCsrf()).isEqualTo("act-1");
  }

  @Test
  void activityPageError_throwsBackendException() {
    session.setCookies("session-id=1");
    server.expect(requestTo(PRIVACY + "/alexa-privacy/apd/activity?ref=activityHistory"))
      .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> sessionManager.ensureActivityCsrf(session))
      .isInstanceOf(BackendException.class)
      .extracting("status").isEqualTo(403);
  }

  @Test
  void bearerToken_fetchedOnceThenCached() {
    server.expect(requestTo(IDENTITY + "/auth/token"))
      .andExpect(method(HttpMethod.POST))
      .andExpect(header("x-amzn-identity-auth-domain", "api.amazon.com"))
      .andRespond(withSuccess("{\"access_token\":\"Atna|bearer-token-value-0123456789\"}",
        MediaType.APPLICATION_JSON));

    sessionManager.ensureBearerToken(session);
    sessionManager.ensureBearerToken(session);

    assertThat(session.getBearerToken()).isEqualTo("Atna|bearer-token-value-0123456789");
    server.verify();
  }

  @Test
  void bearerToken_missingAccessToken_throwsProtocolException() {
    server.expect(requestTo(IDENTITY + "/auth/token"))
      .andRespond(withSuccess("{\"token_type\":\"bearer\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> sessionManager.ensureBearerToken(session))
      .isInstanceOf(ProtocolException.class);
  }

  @Test
  void cookieValue_parsesSetCookieHeader() {
    assertThat(SessionManager.cookieValue("csrf=42; Path=/", "csrf")).isEqualTo("42");
    assertThat(SessionManager.cookieValue(" csrf=7", "csrf")).isEqualTo("7");
    assertThat(SessionManager.cookieValue("xcsrf=1", "csrf")).isNull();
  }
}
