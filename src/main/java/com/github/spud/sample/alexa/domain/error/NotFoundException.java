package com.github.spud.sample.alexa.domain.error;

/**
 * 指定名称的设备、例程或会话不存在
 */
public class NotFoundException extends AlexaException {

  public NotFoundException(String message) {
    super(message);
  }
}
