package com.github.spud.sample.alexa.domain.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alexa+ 会话及其关联设备
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

  private String conversationId;

  /**
   * 最近一轮的设备名，没有时取创建时的设备名
   */
  private String deviceName;

  private String creationTime;

  private String lastTurnTime;
}
