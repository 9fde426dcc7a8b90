package com.github.spud.sample.alexa.domain.correlation;

import com.github.spud.sample.alexa.domain.history.HistoryRecord;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * 判断一条语音历史记录是否是某个问题的回答
 * <p>
 * 近似规则：记录属于目标设备、时间不早于下界、识别文本包含问题前 20 个字符（不区分大小写）、且有回答文本。相似开头的问题可能误匹配，
 * 很短的问题可能漏匹配。
 */
public class HistoryRecordMatcher {

  public static final int PREFIX_LENGTH = 20;

  private final String serialNumber;
  private final long lowerBoundMillis;
  private final String questionPrefix;

  public HistoryRecordMatcher(String serialNumber, Instant lowerBound, String question) {
    this.serialNumber = Objects.requireNonNull(serialNumber, "device serial number");
    this.lowerBoundMillis = lowerBound.toEpochMilli();
    this.questionPrefix = question.substring(0, Math.min(question.length(), PREFIX_LENGTH))
      .toLowerCase(Locale.ROOT);
  }

  public boolean matches(HistoryRecord record) {
    if (record.getRecordKey() == null || !record.getRecordKey().contains(serialNumber)) {
      return false;
    }
    if (record.getTimestamp() < lowerBoundMillis) {
      return false;
    }
    String utterance = record.getCustomerUtterance();
    if (!StringUtils.hasLength(utterance)
      || !utterance.toLowerCase(Locale.ROOT).contains(questionPrefix)) {
      return false;
    }
    return StringUtils.hasLength(record.getAlexaResponse());
  }
}
