package com.github.spud.sample.alexa.domain.avs;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.util.JsonUtils;
import org.springframework.util.StringUtils;

/**
 * 构造 AVS 事件附带的设备上下文
 * <p>
 * 固定的 15 项状态模拟手机 App 的文本交互（Text 焦点、语音空闲），最后追加 Alexa.Conversation 状态，已知会话 ID 时带上该 ID。
 */
public class AvsContextFactory {

  static final String RECOGNIZED_PERSON_ID =
    "amzn1.actor.person.did.AP4LASCN2HNWAAMTI32QX37S6QDPIFEQ2UGPIFWPF54F3Y7WDU4V4X273UV3BSP7ENUDDTIJ";
  static final String EXTERNAL_MEDIA_AGENT = "XOGFXO466L";

  public ArrayNode build(String conversationId) {
    ArrayNode contexts = JsonUtils.objectMapper().createArrayNode();

    ObjectNode speech = entry(contexts, "SpeechSynthesizer", "SpeechState");
    speech.put("playerActivity", "FINISHED");
    speech.put("token", "");
    speech.put("offsetInMilliseconds", 0);

    entry(contexts, "SpeechRecognizer", "RecognizerState").put("wakeword", "ALEXA");

    ObjectNode volume = entry(contexts, "Speaker", "VolumeState");
    volume.put("volume", 50);
    volume.put("muted", false);

    ObjectNode window = entry(contexts, "Alexa.Display.Window", "WindowState");
    window.put("defaultWindowId", "app_window");
    ObjectNode instance = window.putArray("instances").addObject();
    instance.put("id", "app_window");
    instance.put("templateId", "app_window_template");
    ObjectNode windowConfig = instance.putObject("configuration");
    windowConfig.put("interactionMode", "mobile_mode");
    windowConfig.put("sizeConfigurationId", "fullscreen");

    entry(contexts, "VisualActivityTracker", "ActivityState")
      .putObject("focused").put("interface", "Text");

    ObjectNode dialog = entry(contexts, "AudioActivityTracker", "ActivityState")
      .putObject("dialog");
    dialog.put("interface", "SpeechSynthesizer");
    dialog.put("idleTimeInMilliseconds", 100000);

    ObjectNode alerts = entry(contexts, "Alerts", "AlertsState");
    alerts.putArray("allAlerts");
    alerts.putArray("activeAlerts");

    ObjectNode trusted = entry(contexts, "Alexa.IOComponents", "TrustedStates");
    trusted.putArray("sessionStates");
    trusted.put("unlockState", "NEVER_UNLOCKED");

    ObjectNode components = entry(contexts, "Alexa.IOComponents", "IOComponentStates");
    components.putArray("activeIOComponents");
    components.putArray("allIOComponents");

    ObjectNode playback = entry(contexts, "Alexa.PlaybackStateReporter", "PlaybackState");
    playback.put("state", "IDLE");
    playback.put("shuffle", "NOT_SHUFFLED");
    playback.put("repeat", "NOT_REPEATED");
    playback.put("favorite", "NOT_RATED");
    playback.put("positionMilliseconds", 0);
    playback.putArray("supportedOperations").add("Play").add("Pause").add("Previous").add("Next");
    playback.putArray("players");

    entry(contexts, "Alexa.IOComponents.Bluetooth", "BluetoothState").putArray("bluetoothStates");

    ObjectNode person = entry(contexts, "Alexa.Identity.Recognition", "RecognitionState")
      .putObject("RecognitionState").putObject("primaryPerson");
    person.put("acl", 100);
    person.put("id", RECOGNIZED_PERSON_ID);

    ObjectNode mediaPlayer = entry(contexts, "ExternalMediaPlayer", "ExternalMediaPlayerState");
    mediaPlayer.put("agent", EXTERNAL_MEDIA_AGENT);
    mediaPlayer.put("spiVersion", "2.2.0");
    mediaPlayer.putArray("players");
    mediaPlayer.put("playerInFocus", "");

    ObjectNode phone = entry(contexts, "Alexa.Comms.PhoneCallController",
      "PhoneCallControllerState");
    phone.putArray("allCalls");
    phone.putObject("currentCall");
    phone.putObject("device").put("connectionState", "DISCONNECTED");
    phone.putObject("configuration").putArray("callingFeature").addObject()
      .put("OVERRIDE_RINGTONE_SUPPORTED", "false");

    ObjectNode endpoint = entry(contexts, "Alexa.Comms.MessagingController",
      "MessagingControllerState").putArray("messagingEndpointStates").addObject();
    endpoint.putObject("messagingEndpointInfo").put("name", "DEFAULT");
    ObjectNode permissions = endpoint.putObject("permissions");
    permissions.put("sendPermission", "OFF");
    permissions.put("readPermission", "OFF");
    endpoint.put("connectionState", "DISCONNECTED");

    conversationState(entry(contexts, "Alexa.Conversation", "ConversationState"), conversationId);
    return contexts;
  }

  private void conversationState(ObjectNode payload, String conversationId) {
    payload.put("type", "VCF2");
    payload.put("version", "2024.1");
    payload.put("windowState", "NORMAL");
    ObjectNode size = payload.putObject("size");
    size.put("width", 430);
    size.put("height", 932);
    ObjectNode scrollable = payload.putObject("scrollable");
    scrollable.put("direction", "vertical");
    scrollable.put("allowForward", false);
    scrollable.put("allowBackward", true);
    payload.putArray("elements");
    if (StringUtils.hasText(conversationId)) {
      payload.put("conversationId", conversationId);
    }
  }

  /**
   * 追加一项 {header, payload} 并返回 payload
   */
  private static ObjectNode entry(ArrayNode contexts, String namespace, String name) {
    ObjectNode context = contexts.addObject();
    ObjectNode header = context.putObject("header");
    header.put("namespace", namespace);
    header.put("name", name);
    return context.putObject("payload");
  }
}
