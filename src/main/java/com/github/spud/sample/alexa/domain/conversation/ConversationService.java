package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.NoConversationException;
import com.github.spud.sample.alexa.domain.error.NotFoundException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.session.SessionManager;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.domain.transport.RawResponse;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

/**
 * Alexa+ 会话与片段查询（AVS 主机，bearer token 认证）
 */
@Slf4j
public class ConversationService {

  private final AlexaTransport transport;
  private final SessionManager sessionManager;

  public ConversationService(AlexaTransport transport, SessionManager sessionManager) {
    this.transport = transport;
    this.sessionManager = sessionManager;
  }

  /**
   * 当前会话的全部片段
   */
  public FragmentPage getFragments(AlexaSession session) {
    if (!session.hasConversationId()) {
      throw new NoConversationException("No conversation ID set");
    }
    sessionManager.ensureBearerToken(session);

    RawResponse response = get(session, "/v1/conversations/" + session.getConversationId()
      + "/fragments/synchronize");
    if (!response.isOk()) {
      throw new BackendException("Conversation fragments", response.getStatus(),
        response.getBody());
    }

    FragmentPage page = JsonUtils.readBody(response.getBody(), FragmentPage.class,
      "conversation fragments");
    if (log.isDebugEnabled()) {
      long agentWithText = page.getFragments().stream()
        .filter(f -> f.getMetadata() != null
          && ConversationFragment.AGENT_PURPOSE.equals(f.getMetadata().getPurpose()))
        .filter(f -> StringUtils.hasText(f.getText()))
        .count();
      log.debug("Fragments: {} total, {} AGENT with text", page.getFragments().size(),
        agentWithText);
    }
    return page;
  }

  public List<Conversation> getConversations(AlexaSession session) {
    sessionManager.ensureBearerToken(session);

    RawResponse response = get(session, "/v1/conversations");
    if (!response.isOk()) {
      throw new BackendException("Conversations", response.getStatus(), response.getBody());
    }

    List<Conversation> conversations = new ArrayList<>();
    for (JsonNode item : JsonUtils.readBody(response.getBody(), "conversations")
      .path("conversations")) {
      JsonNode creation = item.path("creation");
      JsonNode lastTurn = item.path("lastTurn");
      String deviceName = lastTurn.path("origin").path("name").asText("");
      if (deviceName.isEmpty()) {
        deviceName = creation.path("origin").path("name").asText("");
      }
      conversations.add(Conversation.builder()
        .conversationId(item.path("id").asText(null))
        .deviceName(deviceName)
        .creationTime(creation.path("time").asText(null))
        .lastTurnTime(lastTurn.path("time").asText(null))
        .build());
    }
    return conversations;
  }

  /**
   * 设备最近使用的会话：先按设备名精确匹配（不区分大小写），再按子串匹配，取最近一轮最晚者
   */
  public Conversation findConversationForDevice(AlexaSession session, String deviceName) {
    List<Conversation> conversations = getConversations(session);
    String wanted = deviceName.toLowerCase(Locale.ROOT);

    return latest(conversations, c -> name(c).equals(wanted))
      .or(() -> latest(conversations, c -> name(c).contains(wanted)))
      .orElseThrow(() -> new NotFoundException(
        "No conversation found for device '" + deviceName + "'"));
  }

  private static Optional<Conversation> latest(List<Conversation> conversations,
    Predicate<Conversation> filter) {
    // ISO-8601 时间串可直接按字典序比较
    return conversations.stream()
      .filter(filter)
      .max(Comparator.comparing(c -> c.getLastTurnTime() != null ? c.getLastTurnTime() : ""));
  }

  private static String name(Conversation conversation) {
    return conversation.getDeviceName() != null
      ? conversation.getDeviceName().toLowerCase(Locale.ROOT) : "";
  }

  private RawResponse get(AlexaSession session, String path) {
    return transport.get(transport.getEndpoints().getAvsUrl() + path, headers -> {
      headers.setBearerAuth(session.getBearerToken());
      headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      AlexaTransport.setIfPresent(headers, HttpHeaders.COOKIE, session.getCookies());
    });
  }
}
