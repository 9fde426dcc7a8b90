package com.github.spud.sample.alexa.domain.error;

import lombok.Getter;

/**
 * 已认证调用返回非 2xx 状态
 */
@Getter
public class BackendException extends AlexaException {

  private final int status;
  private final String body;

  public BackendException(String operation, int status, String body) {
    super(operation + " failed with status " + status + ": " + body);
    this.status = status;
    this.body = body;
  }
}
