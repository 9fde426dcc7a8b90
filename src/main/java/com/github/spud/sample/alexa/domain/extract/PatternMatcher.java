package com.github.spud.sample.alexa.domain.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;

/**
 * 单个文本匹配器：命名的正则，取第一个捕获组
 */
@Getter
public class PatternMatcher {

  private final String name;
  private final Pattern pattern;

  public PatternMatcher(String name, String regex) {
    this(name, Pattern.compile(regex));
  }

  public PatternMatcher(String name, Pattern pattern) {
    this.name = name;
    this.pattern = pattern;
  }

  /**
   * 第一个匹配的捕获组
   */
  public Optional<String> match(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = pattern.matcher(text);
    if (matcher.find() && matcher.groupCount() >= 1) {
      return Optional.ofNullable(matcher.group(1));
    }
    return Optional.empty();
  }

  /**
   * 所有匹配的捕获组，按出现顺序
   */
  public List<String> matchAll(String text) {
    List<String> values = new ArrayList<>();
    if (text == null) {
      return values;
    }
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      if (matcher.groupCount() >= 1 && matcher.group(1) != null) {
        values.add(matcher.group(1));
      }
    }
    return values;
  }
}
