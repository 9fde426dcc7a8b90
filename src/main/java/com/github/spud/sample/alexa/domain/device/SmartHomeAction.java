package com.github.spud.sample.alexa.domain.device;

import lombok.Getter;

/**
 * phoenix state 接口支持的控制动作
 */
@Getter
public enum SmartHomeAction {
  TURN_ON("turnOn"),
  TURN_OFF("turnOff"),
  SET_BRIGHTNESS("setBrightness");

  private final String wireName;

  SmartHomeAction(String wireName) {
    this.wireName = wireName;
  }
}
