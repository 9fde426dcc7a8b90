package com.github.spud.sample.alexa.domain.correlation;

import com.github.spud.sample.alexa.domain.command.Command;
import com.github.spud.sample.alexa.domain.command.CommandDispatcher;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.domain.error.ResponseTimeoutException;
import com.github.spud.sample.alexa.domain.history.HistoryRecord;
import com.github.spud.sample.alexa.domain.history.HistoryService;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * ask：发出文本命令后轮询语音历史，取设备对该问题的回答
 */
@Slf4j
public class VoiceResponseCorrelator {

  static final Duration ISSUE_BUFFER = Duration.ofSeconds(1);
  static final Duration WINDOW_AHEAD = Duration.ofSeconds(60);

  private final CommandDispatcher dispatcher;
  private final HistoryService historyService;
  private final PollingPolicy pollingPolicy;

  public VoiceResponseCorrelator(CommandDispatcher dispatcher, HistoryService historyService,
    PollingPolicy pollingPolicy) {
    this.dispatcher = dispatcher;
    this.historyService = historyService;
    this.pollingPolicy = pollingPolicy;
  }

  public String ask(AlexaSession session, Device device, String question, Duration timeout) {
    Instant lowerBound = pollingPolicy.getClock().instant().minus(ISSUE_BUFFER);
    HistoryRecordMatcher matcher =
      new HistoryRecordMatcher(device.getSerialNumber(), lowerBound, question);

    dispatcher.dispatch(session, Command.textCommand(device, question));

    Optional<String> reply = pollingPolicy.poll(timeout, () -> {
      Instant windowEnd = pollingPolicy.getClock().instant().plus(WINDOW_AHEAD);
      for (HistoryRecord record : historyService.getRecords(session, lowerBound, windowEnd)) {
        if (matcher.matches(record)) {
          return Optional.of(record.getAlexaResponse());
        }
      }
      return Optional.empty();
    });

    return reply.orElseThrow(() ->
      new ResponseTimeoutException("Timed out waiting for Alexa response", timeout));
  }
}
