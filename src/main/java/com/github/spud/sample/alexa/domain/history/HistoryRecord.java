package com.github.spud.sample.alexa.domain.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条语音历史记录（精简后）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecord {

  /**
   * customerId#timestamp#deviceType#serialNumber
   */
  private String recordKey;

  /**
   * epoch 毫秒
   */
  private long timestamp;

  /**
   * recordKey 第 4 段（设备序列号）
   */
  private String device;

  /**
   * 用户说的话（ASR）
   */
  private String customerUtterance;

  /**
   * Alexa 的回答（TTS）
   */
  private String alexaResponse;
}
