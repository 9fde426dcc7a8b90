package com.github.spud.sample.alexa.domain.avs;

import lombok.Value;

/**
 * TextMessage 的直接响应。204 时三者皆为空。
 */
@Value
public class TextMessageReply {

  String conversationId;
  String responseText;
  boolean noContent;

  public static TextMessageReply empty() {
    return new TextMessageReply(null, null, true);
  }

  public boolean hasConversationId() {
    return conversationId != null && !conversationId.isEmpty();
  }

  public boolean hasResponseText() {
    return responseText != null && !responseText.isEmpty();
  }
}
