package com.github.spud.sample.alexa.domain.transport;

import lombok.Getter;

/**
 * 按站点域名选择各服务主机
 */
@Getter
public class AlexaEndpoints {

  static final String US_DOMAIN = "amazon.com";

  private final String amazonDomain;
  private final String avsUrl;

  public AlexaEndpoints(String amazonDomain, String avsUrl) {
    this.amazonDomain = amazonDomain;
    this.avsUrl = avsUrl.endsWith("/") ? avsUrl.substring(0, avsUrl.length() - 1) : avsUrl;
  }

  /**
   * 美国站用 pitangui，其余站点用 layla
   */
  public String apiUrl() {
    if (US_DOMAIN.equals(amazonDomain)) {
      return "https://pitangui.amazon.com";
    }
    return "https://layla.amazon.com";
  }

  public String alexaUrl() {
    return "https://alexa." + amazonDomain;
  }

  public String privacyUrl() {
    return "https://www." + amazonDomain;
  }

  public String identityUrl() {
    return "https://api.amazon.com";
  }

  public String identityAuthDomain() {
    return "api." + amazonDomain;
  }

  public String activityPageUrl() {
    return privacyUrl() + "/alexa-privacy/apd/activity?ref=activityHistory";
  }
}
