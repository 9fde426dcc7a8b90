package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentItem {

  public static final String ATTRIBUTION_STYLE = "text-style-attribution";

  private String text;

  private String style;

  public boolean isAttribution() {
    return ATTRIBUTION_STYLE.equals(style);
  }
}
