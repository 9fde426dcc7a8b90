package com.github.spud.sample.alexa.domain.transport;

import java.util.List;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * 未做状态判断的原始 HTTP 响应
 */
@Value
public class RawResponse {

  int status;
  HttpHeaders headers;
  String body;

  public boolean isOk() {
    return status == 200;
  }

  public boolean isNoContent() {
    return status == 204;
  }

  public boolean isError() {
    return status >= 400;
  }

  public List<String> setCookieHeaders() {
    List<String> values = headers.get(HttpHeaders.SET_COOKIE);
    return values != null ? values : List.of();
  }
}
