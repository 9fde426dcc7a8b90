package com.github.spud.sample.alexa.domain.session;

import lombok.Data;
import lombok.ToString;
import org.springframework.util.StringUtils;

/**
 * 一个已认证客户端实例持有的全部凭据与会话状态
 * <p>
 * 单一持有者、原地修改、无锁：同一实例不能在多个线程间并发使用。凭据按依赖顺序获取：cookies → csrf →（按需）activity csrf、bearer
 * token。字段一旦填充，在会话生命周期内不再重新校验，过期只会以 HTTP 失败的形式暴露。
 */
@Data
public class AlexaSession {

  /**
   * 长期有效的 refresh token
   */
  @ToString.Exclude
  private final String refreshToken;

  /**
   * 市场域名，例如 amazon.com
   */
  private final String amazonDomain;

  /**
   * 会话 cookie 串（Name=Value; ...）
   */
  @ToString.Exclude
  private String cookies;

  /**
   * alexa 主站 CSRF token
   */
  @ToString.Exclude
  private String csrf;

  /**
   * 活动历史页面的 CSRF token（独立信任域，按需获取）
   */
  @ToString.Exclude
  private String activityCsrf;

  /**
   * AVS 会话接口的 bearer token（获取后在进程生命周期内缓存）
   */
  @ToString.Exclude
  private String bearerToken;

  /**
   * 客户 ID，首次列出设备时得到
   */
  private String customerId;

  /**
   * 当前 Alexa+ 会话 ID，可由外部设置或由后端返回
   */
  private String conversationId;

  public boolean hasCookies() {
    return StringUtils.hasText(cookies);
  }

  public boolean hasCsrf() {
    return StringUtils.hasText(csrf);
  }

  public boolean hasActivityCsrf() {
    return StringUtils.hasText(activityCsrf);
  }

  public boolean hasBearerToken() {
    return StringUtils.hasText(bearerToken);
  }

  public boolean hasCustomerId() {
    return StringUtils.hasText(customerId);
  }

  public boolean hasConversationId() {
    return StringUtils.hasText(conversationId);
  }
}
