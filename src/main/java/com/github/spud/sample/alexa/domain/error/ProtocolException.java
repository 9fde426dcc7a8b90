package com.github.spud.sample.alexa.domain.error;

/**
 * 响应中缺少预期的字段或模式（后端不保证该响应格式）
 */
public class ProtocolException extends AlexaException {

  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
