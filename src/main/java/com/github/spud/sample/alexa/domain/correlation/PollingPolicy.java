package com.github.spud.sample.alexa.domain.correlation;

import com.github.spud.sample.alexa.domain.error.AlexaException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 固定间隔、截止时间约束的轮询
 * <p>
 * 每轮先等待一个间隔再尝试；尝试抛出的运行时异常记录后继续，直到截止时间。没有退避和抖动。
 */
@Slf4j
@Getter
public class PollingPolicy {

  public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

  private final Duration interval;
  private final Clock clock;
  private final Sleeper sleeper;

  public PollingPolicy(Duration interval) {
    this(interval, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public PollingPolicy(Duration interval, Clock clock, Sleeper sleeper) {
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive");
    }
    this.interval = interval;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * 轮询直到 attempt 返回非空结果或超过截止时间
   *
   * @return 第一个非空结果；超时返回 empty
   */
  public <T> Optional<T> poll(Duration timeout, Supplier<Optional<T>> attempt) {
    Instant deadline = clock.instant().plus(timeout);
    int count = 0;

    while (clock.instant().isBefore(deadline)) {
      pause();
      count++;
      try {
        Optional<T> result = attempt.get();
        if (result.isPresent()) {
          log.debug("Poll {} succeeded", count);
          return result;
        }
        log.debug("Poll {}: no result yet", count);
      } catch (RuntimeException e) {
        log.debug("Poll {} failed, retrying: {}", count, e.getMessage());
      }
    }

    log.debug("Polling gave up after {} attempts", count);
    return Optional.empty();
  }

  private void pause() {
    try {
      sleeper.sleep(interval);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AlexaException("Polling interrupted", e);
    }
  }
}
