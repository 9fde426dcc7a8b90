package com.github.spud.sample.alexa.domain.client;

import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.avs.AvsContextFactory;
import com.github.spud.sample.alexa.domain.avs.AvsEventFactory;
import com.github.spud.sample.alexa.domain.avs.AvsProtocolHandler;
import com.github.spud.sample.alexa.domain.avs.AvsResponseExtractor;
import com.github.spud.sample.alexa.domain.command.CommandDispatcher;
import com.github.spud.sample.alexa.domain.command.SequencePayloadFactory;
import com.github.spud.sample.alexa.domain.conversation.ConversationService;
import com.github.spud.sample.alexa.domain.correlation.ConversationResponseCorrelator;
import com.github.spud.sample.alexa.domain.correlation.PollingPolicy;
import com.github.spud.sample.alexa.domain.correlation.VoiceResponseCorrelator;
import com.github.spud.sample.alexa.domain.device.DeviceService;
import com.github.spud.sample.alexa.domain.device.SmartHomeService;
import com.github.spud.sample.alexa.domain.error.AuthException;
import com.github.spud.sample.alexa.domain.history.HistoryService;
import com.github.spud.sample.alexa.domain.routine.RoutineService;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.session.SessionManager;
import com.github.spud.sample.alexa.domain.transport.AlexaEndpoints;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * 组装并认证 {@link AlexaClient}
 */
@Slf4j
public class AlexaClientFactory {

  private final RestClient restClient;
  private final AlexaProperties properties;
  private final PollingPolicy pollingPolicy;

  public AlexaClientFactory(RestClient restClient, AlexaProperties properties,
    PollingPolicy pollingPolicy) {
    this.restClient = restClient;
    this.properties = properties;
    this.pollingPolicy = pollingPolicy;
  }

  /**
   * 使用配置中的 refresh token 与域名
   */
  public AlexaClient connect() {
    return connect(properties.getRefreshToken(), properties.getAmazonDomain());
  }

  /**
   * 新建会话并完成 cookies 与 CSRF 获取
   */
  public AlexaClient connect(String refreshToken, String amazonDomain) {
    AlexaClient client = create(refreshToken, amazonDomain);
    client.authenticate();
    log.info("Authenticated against {}", amazonDomain);
    return client;
  }

  /**
   * 只组装，不发起任何请求
   */
  public AlexaClient create(String refreshToken, String amazonDomain) {
    if (!StringUtils.hasText(refreshToken)) {
      throw new AuthException("No refresh token configured");
    }
    String domain = StringUtils.hasText(amazonDomain) ? amazonDomain : properties.getAmazonDomain();

    AlexaTransport transport = new AlexaTransport(restClient,
      new AlexaEndpoints(domain, properties.getAvsUrl()));
    SessionManager sessionManager = new SessionManager(transport, properties);
    RoutineService routineService = new RoutineService(transport);
    CommandDispatcher dispatcher = new CommandDispatcher(transport,
      new SequencePayloadFactory(properties.getLocale()), routineService);
    HistoryService historyService = new HistoryService(transport, sessionManager, properties);
    ConversationService conversationService = new ConversationService(transport, sessionManager);
    AvsProtocolHandler protocolHandler = new AvsProtocolHandler(transport, sessionManager,
      new AvsEventFactory(new AvsContextFactory()), new AvsResponseExtractor(), properties);

    return AlexaClient.builder()
      .session(new AlexaSession(refreshToken, domain))
      .sessionManager(sessionManager)
      .deviceService(new DeviceService(transport))
      .smartHomeService(new SmartHomeService(transport))
      .commandDispatcher(dispatcher)
      .routineService(routineService)
      .historyService(historyService)
      .conversationService(conversationService)
      .voiceCorrelator(new VoiceResponseCorrelator(dispatcher, historyService, pollingPolicy))
      .conversationCorrelator(
        new ConversationResponseCorrelator(protocolHandler, conversationService, pollingPolicy))
      .askTimeout(properties.getPoll().getAskTimeout())
      .askPlusTimeout(properties.getPoll().getAskPlusTimeout())
      .build();
  }
}
