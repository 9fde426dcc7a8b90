package com.github.spud.sample.alexa.domain.correlation;

import java.time.Duration;

/**
 * 轮询间隔的挂起方式，测试中替换为推进假时钟
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
