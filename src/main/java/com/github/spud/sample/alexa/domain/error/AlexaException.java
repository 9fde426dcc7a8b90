package com.github.spud.sample.alexa.domain.error;

/**
 * Alexa 客户端抛出的所有异常的基类
 */
public class AlexaException extends RuntimeException {

  public AlexaException(String message) {
    super(message);
  }

  public AlexaException(String message, Throwable cause) {
    super(message, cause);
  }
}
