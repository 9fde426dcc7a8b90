package com.github.spud.sample.alexa.domain.extract;

import com.github.spud.sample.alexa.domain.error.ProtocolException;
import java.util.List;

/**
 * 从活动历史 HTML 页面中提取 anti-csrf token
 * <p>
 * 该页面没有稳定的机器契约，按顺序尝试：meta 标签、data 属性、内嵌脚本变量、anti-csrftoken-a2z 标记。页面格式漂移视为预期的失败模式，以
 * {@link ProtocolException} 暴露。
 */
public class ActivityCsrfExtractor {

  public static final PatternMatcher META_TAG =
    new PatternMatcher("meta-tag", "<meta name=\"csrf-token\" content=\"([^\"]+)\"");

  public static final PatternMatcher DATA_ATTRIBUTE =
    new PatternMatcher("data-attribute", "data-csrf=\"([^\"]+)\"");

  public static final PatternMatcher SCRIPT_VARIABLE =
    new PatternMatcher("script-variable", "\"csrfToken\"\\s*:\\s*\"([^\"]+)\"");

  public static final PatternMatcher ANTI_CSRF_MARKER =
    new PatternMatcher("anti-csrf-marker", "anti-csrftoken-a2z['\":\\s]+['\"]([^'\"]+)['\"]");

  private final OrderedExtractor extractor;

  public ActivityCsrfExtractor() {
    this(List.of(META_TAG, DATA_ATTRIBUTE, SCRIPT_VARIABLE, ANTI_CSRF_MARKER));
  }

  public ActivityCsrfExtractor(List<PatternMatcher> matchers) {
    this.extractor = new OrderedExtractor(matchers);
  }

  public String extract(String html) {
    return extractor.extract(html)
      .orElseThrow(() -> new ProtocolException("Activity CSRF token not found in page"));
  }
}
