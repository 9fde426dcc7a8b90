package com.github.spud.sample.alexa.domain.error;

/**
 * 没有可轮询的会话 ID
 */
public class NoConversationException extends AlexaException {

  public NoConversationException(String message) {
    super(message);
  }
}
