package com.github.spud.sample.alexa.domain.command;

import com.github.spud.sample.alexa.domain.device.Device;
import java.util.Objects;
import lombok.Value;

/**
 * 单次派发的命令：类型、文本（或例程名）与目标设备
 */
@Value
public class Command {

  CommandKind kind;
  String text;
  Device device;

  private Command(CommandKind kind, String text, Device device) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.text = Objects.requireNonNull(text, "text");
    this.device = device;
  }

  public static Command speak(Device device, String text) {
    return new Command(CommandKind.SPEAK, text, Objects.requireNonNull(device, "device"));
  }

  /**
   * device 仅用于在客户 ID 未知时提供默认值
   */
  public static Command announce(Device device, String text) {
    return new Command(CommandKind.ANNOUNCE, text, device);
  }

  public static Command textCommand(Device device, String text) {
    return new Command(CommandKind.TEXT_COMMAND, text, Objects.requireNonNull(device, "device"));
  }

  public static Command automation(Device device, String routineName) {
    return new Command(CommandKind.AUTOMATION, routineName, device);
  }
}
