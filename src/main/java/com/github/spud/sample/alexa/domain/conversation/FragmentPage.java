package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * fragments/synchronize 的响应
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FragmentPage {

  private String conversationId;

  private List<ConversationFragment> fragments = new ArrayList<>();

  private String token;
}
