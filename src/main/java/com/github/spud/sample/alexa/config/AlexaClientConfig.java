package com.github.spud.sample.alexa.config;

import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.client.AlexaClientFactory;
import com.github.spud.sample.alexa.domain.correlation.PollingPolicy;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AlexaClientConfig {

  /**
   * 阻塞式 HTTP 客户端，跟随重定向，超时取自 alexa.http
   */
  @Bean
  public RestClient alexaRestClient(AlexaProperties properties) {
    HttpClient httpClient = HttpClient.newBuilder()
      .connectTimeout(properties.getHttp().getConnectTimeout())
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();

    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.getHttp().getReadTimeout());

    return RestClient.builder()
      .requestFactory(requestFactory)
      .build();
  }

  @Bean
  public PollingPolicy pollingPolicy(AlexaProperties properties) {
    return new PollingPolicy(properties.getPoll().getInterval());
  }

  @Bean
  public AlexaClientFactory alexaClientFactory(RestClient alexaRestClient,
    AlexaProperties properties, PollingPolicy pollingPolicy) {
    return new AlexaClientFactory(alexaRestClient, properties, pollingPolicy);
  }
}
