package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.util.StringUtils;

/**
 * 会话片段内容。Card 类型直接带 text，APLFragment 类型的文本在 datasources.cardData 下。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FragmentContent {

  private String type;

  private String cardType;

  private String text;

  private List<ContentItem> items = new ArrayList<>();

  private Datasources datasources = new Datasources();

  /**
   * 片段文本，没有时返回空串
   */
  @JsonIgnore
  public String getDisplayText() {
    if (StringUtils.hasText(text)) {
      return text;
    }
    CardData cardData = datasources != null ? datasources.getCardData() : null;
    if (cardData != null && StringUtils.hasText(cardData.getText())) {
      return cardData.getText();
    }
    return "";
  }

  /**
   * 引用来源条目：优先取直接 items，其次取 cardData.items
   */
  @JsonIgnore
  public List<String> getAttributions() {
    List<ContentItem> source = items;
    if (source == null || source.isEmpty()) {
      CardData cardData = datasources != null ? datasources.getCardData() : null;
      source = cardData != null ? cardData.getItems() : null;
    }
    List<String> attributions = new ArrayList<>();
    if (source != null) {
      for (ContentItem item : source) {
        if (item.isAttribution()) {
          attributions.add(item.getText());
        }
      }
    }
    return attributions;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Datasources {

    private CardData cardData;
  }
}
