package com.github.spud.sample.alexa.domain.extract;

import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 按顺序运行各个独立的匹配器，返回第一个命中的结果
 */
@Slf4j
public class OrderedExtractor {

  @Getter
  private final List<PatternMatcher> matchers;

  public OrderedExtractor(List<PatternMatcher> matchers) {
    this.matchers = List.copyOf(matchers);
  }

  public Optional<String> extract(String text) {
    for (PatternMatcher matcher : matchers) {
      Optional<String> value = matcher.match(text);
      if (value.isPresent()) {
        log.debug("Matched with '{}'", matcher.getName());
        return value;
      }
    }
    return Optional.empty();
  }
}
