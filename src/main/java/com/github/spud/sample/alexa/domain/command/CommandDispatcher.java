package com.github.spud.sample.alexa.domain.command;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.domain.routine.RoutineService;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;

/**
 * 将 {@link Command} 转换为 behaviors/preview 请求并发送
 */
@Slf4j
public class CommandDispatcher {

  static final String PREVIEW_PATH = "/api/behaviors/preview";

  private final AlexaTransport transport;
  private final SequencePayloadFactory payloadFactory;
  private final RoutineService routineService;

  public CommandDispatcher(AlexaTransport transport, SequencePayloadFactory payloadFactory,
    RoutineService routineService) {
    this.transport = transport;
    this.payloadFactory = payloadFactory;
    this.routineService = routineService;
  }

  public void dispatch(AlexaSession session, Command command) {
    Device device = command.getDevice();
    if (!session.hasCustomerId() && device != null
      && StringUtils.hasText(device.getDeviceOwnerCustomerId())) {
      session.setCustomerId(device.getDeviceOwnerCustomerId());
    }

    ObjectNode sequence;
    switch (command.getKind()) {
      case SPEAK:
        sequence = payloadFactory.speak(device, session.getCustomerId(), command.getText());
        break;
      case ANNOUNCE:
        sequence = payloadFactory.announce(session.getCustomerId(), command.getText());
        break;
      case TEXT_COMMAND:
        sequence = payloadFactory.textCommand(device, session.getCustomerId(), command.getText());
        break;
      case AUTOMATION:
        routineService.execute(session, command.getText());
        return;
      default:
        throw new IllegalArgumentException("Unsupported command kind: " + command.getKind());
    }

    transport.request(session, HttpMethod.POST, PREVIEW_PATH,
      SequencePayloadFactory.previewRequest(SequencePayloadFactory.PREVIEW_BEHAVIOR_ID,
        JsonUtils.toJson(sequence)));
    log.info("Sent {} command to {}", command.getKind(),
      device != null ? device.getAccountName() : "all devices");
  }
}
