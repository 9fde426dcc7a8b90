package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Alexa+ 会话中的一个片段
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationFragment {

  public static final String AGENT_PURPOSE = "AGENT";
  public static final String LLM_URI_MARKER = "LLM:APE";

  @JsonProperty("fragmentURI")
  private String fragmentUri;

  private String timestamp;

  private FragmentContent content;

  private Metadata metadata = new Metadata();

  /**
   * 片段文本，无内容时为空串
   */
  @JsonIgnore
  public String getText() {
    return content != null ? content.getDisplayText() : "";
  }

  /**
   * 是否为 LLM 代理产生的回复
   */
  @JsonIgnore
  public boolean isAgentReply() {
    String purpose = metadata != null ? metadata.getPurpose() : null;
    return AGENT_PURPOSE.equals(purpose)
      || (fragmentUri != null && fragmentUri.contains(LLM_URI_MARKER));
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Metadata {

    private String purpose;

    private Provenance provenance;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Provenance {

    private String type;
  }
}
