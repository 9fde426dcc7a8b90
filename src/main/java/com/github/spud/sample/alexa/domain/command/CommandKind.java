package com.github.spud.sample.alexa.domain.command;

/**
 * 命令类型
 */
public enum CommandKind {
  /**
   * 在指定设备上朗读文本
   */
  SPEAK,
  /**
   * 面向客户所有设备的广播
   */
  ANNOUNCE,
  /**
   * 如同口述一样发送给设备的文本指令
   */
  TEXT_COMMAND,
  /**
   * 按名称触发例程
   */
  AUTOMATION
}
