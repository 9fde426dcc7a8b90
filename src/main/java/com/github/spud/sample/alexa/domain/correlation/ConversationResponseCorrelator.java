package com.github.spud.sample.alexa.domain.correlation;

import com.github.spud.sample.alexa.domain.avs.AvsProtocolHandler;
import com.github.spud.sample.alexa.domain.avs.TextMessageReply;
import com.github.spud.sample.alexa.domain.conversation.ConversationFragment;
import com.github.spud.sample.alexa.domain.conversation.ConversationService;
import com.github.spud.sample.alexa.domain.error.NoConversationException;
import com.github.spud.sample.alexa.domain.error.ResponseTimeoutException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * askPlus：经 Alexa+ 事件通道发问，优先取内联回复，否则轮询会话片段
 */
@Slf4j
public class ConversationResponseCorrelator {

  private final AvsProtocolHandler protocolHandler;
  private final ConversationService conversationService;
  private final PollingPolicy pollingPolicy;

  public ConversationResponseCorrelator(AvsProtocolHandler protocolHandler,
    ConversationService conversationService, PollingPolicy pollingPolicy) {
    this.protocolHandler = protocolHandler;
    this.conversationService = conversationService;
    this.pollingPolicy = pollingPolicy;
  }

  public String askPlus(AlexaSession session, String question, Duration timeout) {
    try {
      protocolHandler.synchronizeState(session);
    } catch (RuntimeException e) {
      log.warn("SynchronizeState failed, continuing: {}", e.getMessage());
    }

    TextMessageReply reply = protocolHandler.sendTextMessage(session, question);
    if (reply.hasResponseText()) {
      log.debug("Got inline response from AVS");
      return reply.getResponseText();
    }
    if (reply.hasConversationId()) {
      session.setConversationId(reply.getConversationId());
      log.debug("Polling conversation {}", reply.getConversationId());
    }
    if (!session.hasConversationId()) {
      throw new NoConversationException("No conversation ID received from Alexa");
    }

    Optional<String> answer = pollingPolicy.poll(timeout, () -> {
      for (ConversationFragment fragment : conversationService.getFragments(session)
        .getFragments()) {
        String text = fragment.getText();
        if (StringUtils.hasText(text) && fragment.isAgentReply()) {
          return Optional.of(withAttributions(text, fragment));
        }
      }
      return Optional.empty();
    });

    return answer.orElseThrow(() ->
      new ResponseTimeoutException("Timed out waiting for Alexa+ response", timeout));
  }

  static String withAttributions(String text, ConversationFragment fragment) {
    StringBuilder result = new StringBuilder(text);
    for (String attribution : fragment.getContent().getAttributions()) {
      result.append('\n').append(attribution);
    }
    return result.toString();
  }
}
