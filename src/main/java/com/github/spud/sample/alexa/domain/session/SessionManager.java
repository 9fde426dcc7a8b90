package com.github.spud.sample.alexa.domain.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.error.AuthException;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.ProtocolException;
import com.github.spud.sample.alexa.domain.extract.ActivityCsrfExtractor;
import com.github.spud.sample.alexa.domain.transport.AlexaEndpoints;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.domain.transport.RawResponse;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

/**
 * 凭据生命周期管理
 * <p>
 * refresh token → 会话 cookies → CSRF →（按需）活动历史 CSRF →（按需）AVS bearer token。每个 ensure 操作在字段已填充时直接返回，
 * 不做过期跟踪。
 */
@Slf4j
public class SessionManager {

  static final String CSRF_COOKIE = "csrf";

  private final AlexaTransport transport;
  private final AlexaProperties properties;
  private final ActivityCsrfExtractor activityCsrfExtractor;

  public SessionManager(AlexaTransport transport, AlexaProperties properties) {
    this(transport, properties, new ActivityCsrfExtractor());
  }

  public SessionManager(AlexaTransport transport, AlexaProperties properties,
    ActivityCsrfExtractor activityCsrfExtractor) {
    this.transport = transport;
    this.properties = properties;
    this.activityCsrfExtractor = activityCsrfExtractor;
  }

  /**
   * 用 refresh token 交换各域名的会话 cookies
   */
  public void ensureCookies(AlexaSession session) {
    if (session.hasCookies()) {
      return;
    }
    AlexaEndpoints endpoints = transport.getEndpoints();

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("app_name", properties.getAppName());
    form.add("requested_token_type", "auth_cookies");
    form.add("source_token_type", "refresh_token");
    form.add("source_token", session.getRefreshToken());
    form.add("domain", "." + session.getAmazonDomain());

    RawResponse response = transport.postForm(
      endpoints.identityUrl() + "/ap/exchangetoken/cookies", form,
      headers -> headers.set("x-amzn-identity-auth-domain", endpoints.identityAuthDomain()));

    if (!response.isOk()) {
      throw new AuthException("Token exchange failed with status " + response.getStatus() + ": "
        + response.getBody());
    }

    JsonNode cookiesByDomain = JsonUtils.readBody(response.getBody(), "token exchange")
      .path("response").path("tokens").path("cookies");

    List<String> parts = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> domains = cookiesByDomain.fields();
    while (domains.hasNext()) {
      for (JsonNode cookie : domains.next().getValue()) {
        String name = cookie.path("Name").asText("");
        if (StringUtils.hasText(name)) {
          parts.add(name + "=" + cookie.path("Value").asText(""));
        }
      }
    }

    if (parts.isEmpty()) {
      throw new AuthException("No cookies received from token exchange");
    }
    session.setCookies(String.join("; ", parts));
    log.info("Exchanged refresh token for {} session cookies on {}", parts.size(),
      session.getAmazonDomain());
  }

  /**
   * 获取主站 CSRF：优先取响应 Set-Cookie，其次取已有 cookie 串
   */
  public void ensureCsrf(AlexaSession session) {
    if (session.hasCsrf()) {
      return;
    }
    requireCookies(session);

    RawResponse response = transport.get(transport.getEndpoints().alexaUrl() + "/api/language",
      headers -> {
        headers.set(HttpHeaders.COOKIE, session.getCookies());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      });

    for (String header : response.setCookieHeaders()) {
      String value = cookieValue(header, CSRF_COOKIE);
      if (StringUtils.hasText(value)) {
        session.setCsrf(value);
        session.setCookies(session.getCookies() + "; " + CSRF_COOKIE + "=" + value);
        log.debug("CSRF token obtained from response cookie");
        return;
      }
    }

    for (String part : session.getCookies().split(";")) {
      String value = cookieValue(part, CSRF_COOKIE);
      if (StringUtils.hasText(value)) {
        session.setCsrf(value);
        log.debug("CSRF token reused from session cookies");
        return;
      }
    }

    throw new AuthException("CSRF token not found");
  }

  /**
   * 获取活动历史页面的 CSRF token（独立信任域）
   */
  public void ensureActivityCsrf(AlexaSession session) {
    if (session.hasActivityCsrf()) {
      return;
    }
    requireCookies(session);

    RawResponse response = transport.get(transport.getEndpoints().activityPageUrl(), headers -> {
      headers.set(HttpHeaders.COOKIE, session.getCookies());
      headers.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml");
      headers.set(HttpHeaders.USER_AGENT, properties.getBrowserUserAgent());
    });

    if (response.isError()) {
      throw new BackendException("Activity page", response.getStatus(), response.getBody());
    }

    session.setActivityCsrf(activityCsrfExtractor.extract(response.getBody()));
    log.debug("Activity CSRF token obtained");
  }

  /**
   * 获取 AVS 接口使用的 bearer token，进程生命周期内缓存
   */
  public void ensureBearerToken(AlexaSession session) {
    if (session.hasBearerToken()) {
      log.debug("Using cached bearer token");
      return;
    }
    AlexaEndpoints endpoints = transport.getEndpoints();

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("requested_token_type", "access_token");
    form.add("source_token_type", "refresh_token");
    form.add("source_token", session.getRefreshToken());
    form.add("app_name", properties.getAppName());
    form.add("app_version", properties.getAppVersion());

    log.debug("Requesting new bearer token");
    RawResponse response = transport.postForm(endpoints.identityUrl() + "/auth/token", form,
      headers -> {
        headers.set("x-amzn-identity-auth-domain", "api.amazon.com");
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      });

    if (!response.isOk()) {
      throw new AuthException("Bearer token request failed with status " + response.getStatus()
        + ": " + response.getBody());
    }

    String token = JsonUtils.readBody(response.getBody(), "bearer token")
      .path("access_token").asText("");
    if (!StringUtils.hasText(token)) {
      throw new ProtocolException("Bearer token response has no access_token");
    }
    session.setBearerToken(token);
    log.debug("Got bearer token: {}...", token.substring(0, Math.min(20, token.length())));
  }

  private void requireCookies(AlexaSession session) {
    if (!session.hasCookies()) {
      throw new AuthException("Session has no cookies; exchange the refresh token first");
    }
  }

  /**
   * 从 "name=value; Path=/" 形式中取指定 cookie 的值
   */
  static String cookieValue(String cookie, String name) {
    String pair = cookie.split(";", 2)[0].trim();
    int idx = pair.indexOf('=');
    if (idx <= 0 || !pair.substring(0, idx).trim().equals(name)) {
      return null;
    }
    return pair.substring(idx + 1).trim();
  }
}
