package com.github.spud.sample.alexa.domain.routine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户配置的例程，sequence 保留后端返回的原始 JSON 文本
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Routine {

  private String automationId;

  private String name;

  private String sequence;
}
