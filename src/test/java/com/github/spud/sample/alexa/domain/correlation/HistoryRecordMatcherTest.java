package com.github.spud.sample.alexa.domain.correlation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.alexa.domain.history.HistoryRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class HistoryRecordMatcherTest {

  private static final String SERIAL = "G090LF0994210ABC";
  private static final Instant LOWER = Instant.ofEpochMilli(1700000000000L);

  private final HistoryRecordMatcher matcher =
    new HistoryRecordMatcher(SERIAL, LOWER, "What Time Is It in Tokyo right now");

  private HistoryRecord record(long timestamp, String utterance, String response) {
    return HistoryRecord.builder()
      .recordKey("A1#" + timestamp + "#A3S5BH2HU6VAYF#" + SERIAL)
      .timestamp(timestamp)
      .customerUtterance(utterance)
      .alexaResponse(response)
      .build();
  }

  @Test
  void matchesPrefixIgnoringCase() {
    assertThat(matcher.matches(record(1700000000500L, "what time is it in tokyo", "10 PM")))
      .isTrue();
  }

  @Test
  void rejectsRecordBeforeLowerBound() {
    assertThat(matcher.matches(record(1699999999999L, "what time is it in tokyo", "10 PM")))
      .isFalse();
  }

  @Test
  void acceptsRecordExactlyAtLowerBound() {
    assertThat(matcher.matches(record(1700000000000L, "what time is it in tokyo", "10 PM")))
      .isTrue();
  }

  @Test
  void rejectsUtteranceWithoutPrefix() {
    assertThat(matcher.matches(record(1700000000500L, "what time is it", "3 PM"))).isFalse();
  }

  @Test
  void rejectsOtherDevice() {
    HistoryRecord other = record(1700000000500L, "what time is it in tokyo", "10 PM");
    other.setRecordKey("A1#1700000000500#A3S5BH2HU6VAYF#OTHERSERIAL");

    assertThat(matcher.matches(other)).isFalse();
  }

  @Test
  void rejectsEmptyResponse() {
    assertThat(matcher.matches(record(1700000000500L, "what time is it in tokyo", ""))).isFalse();
  }

  @Test
  void shortQuestionUsesWholeText() {
    HistoryRecordMatcher shortMatcher = new HistoryRecordMatcher(SERIAL, LOWER, "Hi");

    assertThat(shortMatcher.matches(record(1700000000500L, "oh hi there", "Hello"))).isTrue();
  }

  @Test
  void rejectsMissingSerialUpFront() {
    assertThatThrownBy(() -> new HistoryRecordMatcher(null, LOWER, "what time is it"))
      .isInstanceOf(NullPointerException.class)
      .hasMessageContaining("serial");
  }
}
