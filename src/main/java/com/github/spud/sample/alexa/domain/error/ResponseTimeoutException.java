package com.github.spud.sample.alexa.domain.error;

import java.time.Duration;
import lombok.Getter;

/**
 * 截止时间前未等到匹配的响应。命令本身可能已经执行。
 */
@Getter
public class ResponseTimeoutException extends AlexaException {

  private final Duration timeout;

  public ResponseTimeoutException(String message, Duration timeout) {
    super(message + " (timeout " + timeout.toMillis() + "ms)");
    this.timeout = timeout;
  }
}
