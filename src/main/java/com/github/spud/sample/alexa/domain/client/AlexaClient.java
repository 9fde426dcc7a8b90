package com.github.spud.sample.alexa.domain.client;

import com.github.spud.sample.alexa.domain.command.Command;
import com.github.spud.sample.alexa.domain.command.CommandDispatcher;
import com.github.spud.sample.alexa.domain.conversation.Conversation;
import com.github.spud.sample.alexa.domain.conversation.ConversationService;
import com.github.spud.sample.alexa.domain.conversation.FragmentPage;
import com.github.spud.sample.alexa.domain.correlation.ConversationResponseCorrelator;
import com.github.spud.sample.alexa.domain.correlation.VoiceResponseCorrelator;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.domain.device.DeviceService;
import com.github.spud.sample.alexa.domain.device.SmartHomeAction;
import com.github.spud.sample.alexa.domain.device.SmartHomeDevice;
import com.github.spud.sample.alexa.domain.device.SmartHomeService;
import com.github.spud.sample.alexa.domain.history.HistoryRecord;
import com.github.spud.sample.alexa.domain.history.HistoryService;
import com.github.spud.sample.alexa.domain.routine.Routine;
import com.github.spud.sample.alexa.domain.routine.RoutineService;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.session.SessionManager;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * 单个已认证会话的客户端入口
 * <p>
 * 持有一个 {@link AlexaSession}，所有操作都在其上原地更新凭据。非线程安全，每个线程（或每个请求）使用独立实例。
 */
@Builder
public class AlexaClient {

  @Getter
  private final AlexaSession session;
  private final SessionManager sessionManager;
  private final DeviceService deviceService;
  private final SmartHomeService smartHomeService;
  private final CommandDispatcher commandDispatcher;
  private final RoutineService routineService;
  private final HistoryService historyService;
  private final ConversationService conversationService;
  private final VoiceResponseCorrelator voiceCorrelator;
  private final ConversationResponseCorrelator conversationCorrelator;
  private final Duration askTimeout;
  private final Duration askPlusTimeout;

  /**
   * cookies 与 CSRF，连接时调用
   */
  public void authenticate() {
    sessionManager.ensureCookies(session);
    sessionManager.ensureCsrf(session);
  }

  public List<Device> getDevices() {
    return deviceService.getDevices(session);
  }

  public Device findDevice(String nameOrSerial) {
    return deviceService.findDevice(session, nameOrSerial);
  }

  public void speak(String deviceName, String text) {
    commandDispatcher.dispatch(session, Command.speak(findDevice(deviceName), text));
  }

  /**
   * 向所有设备广播
   */
  public void announce(String text) {
    commandDispatcher.dispatch(session, Command.announce(deviceService.firstDevice(session), text));
  }

  /**
   * 让设备执行一句文本指令，如同对它说话
   */
  public void textCommand(String deviceName, String text) {
    commandDispatcher.dispatch(session, Command.textCommand(findDevice(deviceName), text));
  }

  public void runRoutine(String routineName) {
    commandDispatcher.dispatch(session, Command.automation(null, routineName));
  }

  public List<Routine> getRoutines() {
    return routineService.getRoutines(session);
  }

  public List<HistoryRecord> getHistory(Instant start, Instant end) {
    return historyService.getRecords(session, start, end);
  }

  public List<SmartHomeDevice> getSmartHomeDevices() {
    return smartHomeService.getSmartHomeDevices(session);
  }

  /**
   * 按名称查找智能家居设备并执行动作，brightness 仅用于 SET_BRIGHTNESS
   */
  public SmartHomeDevice controlSmartHome(String name, SmartHomeAction action,
    Integer brightness) {
    SmartHomeDevice device = smartHomeService.findSmartHomeDevice(session, name);
    smartHomeService.control(session, device.getEntityId(), action, brightness);
    return device;
  }

  public String ask(String deviceName, String question) {
    return ask(deviceName, question, askTimeout);
  }

  public String ask(String deviceName, String question, Duration timeout) {
    return voiceCorrelator.ask(session, findDevice(deviceName), question, timeout);
  }

  public String askPlus(String question) {
    return askPlus(question, askPlusTimeout);
  }

  public String askPlus(String question, Duration timeout) {
    return conversationCorrelator.askPlus(session, question, timeout);
  }

  /**
   * 先切换到设备最近的会话，再发问
   */
  public String askPlusOnDevice(String deviceName, String question, Duration timeout) {
    useConversationOf(deviceName);
    return askPlus(question, timeout);
  }

  public List<Conversation> getConversations() {
    return conversationService.getConversations(session);
  }

  public Conversation useConversationOf(String deviceName) {
    Conversation conversation = conversationService.findConversationForDevice(session, deviceName);
    session.setConversationId(conversation.getConversationId());
    return conversation;
  }

  public FragmentPage getFragments() {
    return conversationService.getFragments(session);
  }

  public void setConversationId(String conversationId) {
    session.setConversationId(conversationId);
  }
}
