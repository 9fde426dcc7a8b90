package com.github.spud.sample.alexa.domain.avs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.session.SessionManager;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.domain.transport.RawResponse;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

/**
 * Alexa+ 事件通道：以 multipart 形式向 /v20160207/events 发送事件
 */
@Slf4j
public class AvsProtocolHandler {

  static final String EVENTS_PATH = "/v20160207/events";

  private final AlexaTransport transport;
  private final SessionManager sessionManager;
  private final AvsEventFactory eventFactory;
  private final AvsResponseExtractor extractor;
  private final AlexaProperties properties;

  public AvsProtocolHandler(AlexaTransport transport, SessionManager sessionManager,
    AvsEventFactory eventFactory, AvsResponseExtractor extractor, AlexaProperties properties) {
    this.transport = transport;
    this.sessionManager = sessionManager;
    this.eventFactory = eventFactory;
    this.extractor = extractor;
    this.properties = properties;
  }

  /**
   * 发送文本消息。204 表示已接受但无内联内容，返回空回复。
   */
  public TextMessageReply sendTextMessage(AlexaSession session, String text) {
    sessionManager.ensureBearerToken(session);

    ObjectNode event = eventFactory.textMessage(text, session.getConversationId());
    log.debug("Sending TextMessage, conversation in context: {}", session.getConversationId());

    RawResponse response = post(session, event, headers -> {
      headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
      headers.set("Priority", "u=1, i");
    });
    log.debug("AVS response status {}, {} bytes", response.getStatus(),
      response.getBody().length());

    if (response.isNoContent()) {
      return TextMessageReply.empty();
    }
    if (!response.isOk()) {
      throw new BackendException("AVS TextMessage", response.getStatus(), response.getBody());
    }

    String body = response.getBody();
    return new TextMessageReply(
      extractor.conversationId(body).orElse(null),
      extractor.responseText(body, text).orElse(null),
      false);
  }

  /**
   * 同步设备状态。200 与 204 都视为成功。
   */
  public void synchronizeState(AlexaSession session) {
    sessionManager.ensureBearerToken(session);

    RawResponse response = post(session, eventFactory.synchronizeState(session.getConversationId()),
      headers -> headers.set("Priority", "u=3"));
    log.debug("SynchronizeState response status {}", response.getStatus());

    if (!response.isOk() && !response.isNoContent()) {
      throw new BackendException("AVS SynchronizeState", response.getStatus(),
        response.getBody());
    }
  }

  private RawResponse post(AlexaSession session, ObjectNode event, Consumer<HttpHeaders> extra) {
    MultipartEventBody multipart = MultipartEventBody.of(JsonUtils.toJson(event));
    return transport.postMultipart(transport.getEndpoints().getAvsUrl() + EVENTS_PATH,
      multipart.getBoundary(), multipart.getBody(), headers -> {
        headers.setBearerAuth(session.getBearerToken());
        headers.set(HttpHeaders.ACCEPT, "*/*");
        headers.set(HttpHeaders.USER_AGENT, properties.getAvsUserAgent());
        AlexaTransport.setIfPresent(headers, HttpHeaders.COOKIE, session.getCookies());
        extra.accept(headers);
      });
  }
}
