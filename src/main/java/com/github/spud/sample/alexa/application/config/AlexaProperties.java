package com.github.spud.sample.alexa.application.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Alexa 客户端配置属性
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "alexa")
public class AlexaProperties {

  /**
   * 长期有效的 refresh token（由浏览器登录工具获取）
   */
  private String refreshToken;

  /**
   * 市场域名，例如 amazon.com、amazon.de
   */
  @NotBlank
  private String amazonDomain = "amazon.com";

  /**
   * 命令负载中使用的语言区域
   */
  @NotBlank
  private String locale = "en-US";

  /**
   * AVS (Alexa+) 事件与会话接口地址
   */
  @NotBlank
  private String avsUrl = "https://avs-alexa-12-na.amazon.com";

  /**
   * 令牌交换时上报的应用名称
   */
  @NotBlank
  private String appName = "Amazon Alexa";

  /**
   * 令牌交换时上报的应用版本
   */
  @NotBlank
  private String appVersion = "2.2.696573.0";

  /**
   * 访问 AVS 接口时使用的 User-Agent（模拟移动端 App）
   */
  private String avsUserAgent = "Alexa/2.2.696573 CFNetwork/3860.200.71 Darwin/25.1.0";

  /**
   * 访问活动记录（隐私）页面时使用的 User-Agent
   */
  private String browserUserAgent =
    "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
      + "Chrome/120.0.0.0 Safari/537.36";

  /**
   * 轮询配置
   */
  private PollConfig poll = new PollConfig();

  /**
   * HTTP 客户端配置
   */
  private HttpConfig http = new HttpConfig();

  @Data
  public static class PollConfig {

    /**
     * 两次轮询之间的固定间隔
     */
    @NotNull
    private Duration interval = Duration.ofMillis(500);

    /**
     * ask 默认等待时间
     */
    @NotNull
    private Duration askTimeout = Duration.ofSeconds(10);

    /**
     * askPlus 默认等待时间
     */
    @NotNull
    private Duration askPlusTimeout = Duration.ofSeconds(15);
  }

  @Data
  public static class HttpConfig {

    /**
     * 连接超时
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * 读取超时
     */
    private Duration readTimeout = Duration.ofSeconds(30);
  }
}
