package com.github.spud.sample.alexa.domain.transport;

import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.TransportException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 通用的带认证请求执行：注入 cookie/csrf 头，JSON 序列化，原始 multipart 体发送。不包含业务逻辑。
 * <p>
 * 未拿到响应的 I/O 失败统一转为 {@link TransportException}。
 */
@Slf4j
public class AlexaTransport {

  private final RestClient restClient;

  @Getter
  private final AlexaEndpoints endpoints;

  public AlexaTransport(RestClient restClient, AlexaEndpoints endpoints) {
    this.restClient = restClient;
    this.endpoints = endpoints;
  }

  /**
   * 对 API 主机（pitangui/layla）发起带认证的 JSON 请求
   */
  public String request(AlexaSession session, HttpMethod method, String path, Object body) {
    return authenticatedJson(session, endpoints.apiUrl(), method, path, body);
  }

  /**
   * 对 alexa.&lt;domain&gt; 发起带认证的 JSON 请求
   */
  public String requestAlexa(AlexaSession session, HttpMethod method, String path, Object body) {
    return authenticatedJson(session, endpoints.alexaUrl(), method, path, body);
  }

  /**
   * form-urlencoded POST，状态码由调用方判断
   */
  public RawResponse postForm(String url, MultiValueMap<String, String> form,
    Consumer<HttpHeaders> headers) {
    return exchange(HttpMethod.POST, url, headers, form, MediaType.APPLICATION_FORM_URLENCODED);
  }

  public RawResponse get(String url, Consumer<HttpHeaders> headers) {
    return exchange(HttpMethod.GET, url, headers, null, null);
  }

  public RawResponse post(String url, String body, MediaType contentType,
    Consumer<HttpHeaders> headers) {
    return exchange(HttpMethod.POST, url, headers, body, contentType);
  }

  /**
   * 单 part 的 multipart/form-data POST，body 已由调用方按 boundary 组装
   */
  public RawResponse postMultipart(String url, String boundary, String body,
    Consumer<HttpHeaders> headers) {
    MediaType contentType = MediaType.parseMediaType("multipart/form-data; boundary=" + boundary);
    return exchange(HttpMethod.POST, url, headers, body, contentType);
  }

  private String authenticatedJson(AlexaSession session, String baseUrl, HttpMethod method,
    String path, Object body) {
    String json = body != null ? JsonUtils.toJson(body) : null;
    log.debug("{} {}{}", method, baseUrl, path);

    RawResponse response = exchange(method, baseUrl + path, headers -> {
      setIfPresent(headers, HttpHeaders.COOKIE, session.getCookies());
      setIfPresent(headers, "csrf", session.getCsrf());
      headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    }, json, MediaType.APPLICATION_JSON);

    if (response.isError()) {
      throw new BackendException(method + " " + path, response.getStatus(), response.getBody());
    }
    return response.getBody();
  }

  private RawResponse exchange(HttpMethod method, String url, Consumer<HttpHeaders> headers,
    Object body, MediaType contentType) {
    RestClient.RequestBodySpec spec = restClient.method(method)
      .uri(URI.create(url))
      .headers(headers != null ? headers : h -> {
      });
    if (contentType != null) {
      spec.contentType(contentType);
    }
    if (body instanceof String) {
      spec.body(((String) body).getBytes(StandardCharsets.UTF_8));
    } else if (body != null) {
      spec.body(body);
    }
    try {
      return spec.exchange((request, response) -> new RawResponse(
        response.getStatusCode().value(),
        response.getHeaders(),
        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
    } catch (RestClientException e) {
      throw new TransportException(method + " " + url + " failed: " + e.getMessage(), e);
    }
  }

  public static void setIfPresent(HttpHeaders headers, String name, String value) {
    if (StringUtils.hasText(value)) {
      headers.set(name, value);
    }
  }
}
