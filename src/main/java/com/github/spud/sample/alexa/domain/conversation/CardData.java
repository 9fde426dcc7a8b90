package com.github.spud.sample.alexa.domain.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * APLFragment 中 datasources.cardData 的内容
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardData {

  private String type;

  private String cardType;

  private String text;

  private List<ContentItem> items = new ArrayList<>();
}
