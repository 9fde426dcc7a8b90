package com.github.spud.sample.alexa.domain.error;

/**
 * 请求未得到任何 HTTP 响应（连接失败、超时、读写中断）
 */
public class TransportException extends AlexaException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
