package com.github.spud.sample.alexa.domain.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.alexa.application.config.AlexaProperties;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.session.SessionManager;
import com.github.spud.sample.alexa.domain.transport.AlexaEndpoints;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.domain.transport.RawResponse;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * 语音活动历史（alexa-privacy 页面接口）
 */
@Slf4j
public class HistoryService {

  static final String ASR_ITEM = "ASR_REPLACEMENT_TEXT";
  static final String TTS_ITEM = "TTS_REPLACEMENT_TEXT";
  static final String REQUEST_BODY = "{\"previousRequestToken\": null}";

  private final AlexaTransport transport;
  private final SessionManager sessionManager;
  private final AlexaProperties properties;

  public HistoryService(AlexaTransport transport, SessionManager sessionManager,
    AlexaProperties properties) {
    this.transport = transport;
    this.sessionManager = sessionManager;
    this.properties = properties;
  }

  /**
   * 查询 [start, end] 区间内的历史记录，按后端返回顺序
   */
  public List<HistoryRecord> getRecords(AlexaSession session, Instant start, Instant end) {
    sessionManager.ensureActivityCsrf(session);
    AlexaEndpoints endpoints = transport.getEndpoints();

    String url = endpoints.privacyUrl()
      + "/alexa-privacy/apd/rvh/customer-history-records-v2/?startTime=" + start.toEpochMilli()
      + "&endTime=" + end.toEpochMilli() + "&pageType=VOICE_HISTORY";

    RawResponse response = transport.post(url, REQUEST_BODY, MediaType.APPLICATION_JSON,
      headers -> {
        AlexaTransport.setIfPresent(headers, HttpHeaders.COOKIE, session.getCookies());
        AlexaTransport.setIfPresent(headers, "csrf", session.getCsrf());
        headers.set("anti-csrftoken-a2z", session.getActivityCsrf());
        headers.set(HttpHeaders.ACCEPT, "application/json, text/plain, */*");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        headers.set(HttpHeaders.ORIGIN, endpoints.privacyUrl());
        headers.set(HttpHeaders.REFERER, endpoints.activityPageUrl());
        headers.set(HttpHeaders.USER_AGENT, properties.getBrowserUserAgent());
      });

    if (response.isError()) {
      throw new BackendException("History", response.getStatus(), response.getBody());
    }

    List<HistoryRecord> records = new ArrayList<>();
    for (JsonNode raw : JsonUtils.readBody(response.getBody(), "history")
      .path("customerHistoryRecords")) {
      records.add(toRecord(raw));
    }
    log.debug("Fetched {} history records", records.size());
    return records;
  }

  static HistoryRecord toRecord(JsonNode raw) {
    String recordKey = raw.path("recordKey").asText("");
    String[] parts = recordKey.split("#", -1);

    StringBuilder utterance = new StringBuilder();
    StringBuilder reply = new StringBuilder();
    for (JsonNode item : raw.path("voiceHistoryRecordItems")) {
      String text = item.path("transcriptText").asText("");
      String type = item.path("recordItemType").asText("");
      if (ASR_ITEM.equals(type)) {
        appendWord(utterance, text);
      } else if (TTS_ITEM.equals(type)) {
        appendWord(reply, text);
      }
    }

    return HistoryRecord.builder()
      .recordKey(recordKey)
      .timestamp(raw.path("timestamp").asLong())
      .device(parts.length >= 4 ? parts[3] : null)
      .customerUtterance(utterance.toString())
      .alexaResponse(reply.toString())
      .build();
  }

  private static void appendWord(StringBuilder target, String text) {
    if (target.length() > 0) {
      target.append(' ');
    }
    target.append(text);
  }
}
