package com.github.spud.sample.alexa.domain.avs;

import com.github.spud.sample.alexa.domain.extract.PatternMatcher;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 从 AVS multipart 响应的原始文本中提取会话 ID 与回复文本
 * <p>
 * 响应是 multipart/related 的指令流，不做结构化解析，只按文本匹配。
 */
@Slf4j
public class AvsResponseExtractor {

  public static final PatternMatcher CONVERSATION_ID =
    new PatternMatcher("conversation-id", "\"conversationId\"\\s*:\\s*\"(amzn1\\.conversation\\.[^\"]+)\"");

  public static final PatternMatcher TEXT =
    new PatternMatcher("text", "\"text\"\\s*:\\s*\"([^\"]+)\"");

  static final String LLM_MARKER = "LLM:APE";
  static final String AGENT_MARKER = "\"purpose\":\"AGENT\"";

  public Optional<String> conversationId(String body) {
    return CONVERSATION_ID.match(body);
  }

  /**
   * 第一个 text 字段通常是用户输入的回显，跳过；同时跳过包含输入原文的匹配。只有响应中带有 LLM 标记时才接受。
   */
  public Optional<String> responseText(String body, String input) {
    if (body == null || !(body.contains(LLM_MARKER) || body.contains(AGENT_MARKER))) {
      return Optional.empty();
    }
    List<String> matches = TEXT.matchAll(body);
    log.debug("Found {} text matches in AVS response", matches.size());
    for (int i = 1; i < matches.size(); i++) {
      String candidate = matches.get(i);
      if (!candidate.contains(input)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
