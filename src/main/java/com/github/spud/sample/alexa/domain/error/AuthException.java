package com.github.spud.sample.alexa.domain.error;

/**
 * 凭据交换或 CSRF 获取失败，需要在客户端之外重新登录
 */
public class AuthException extends AlexaException {

  public AuthException(String message) {
    super(message);
  }

  public AuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
