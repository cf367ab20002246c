/*
 * どこで: Common 共通設定
 * 何を: Clock と RandomGenerator を DI 可能にする
 * なぜ: 配信時刻の決定は「現在」を基準に乱数を引くため、テストで両方を差し替えられるようにする
 */
package com.example.common.config;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** 全呼び出し元で共有されるため、毎回呼び出し元スレッド専用の乱数源から引く。 */
  @Bean
  public RandomGenerator randomGenerator() {
    return new ThreadLocalRandomGenerator();
  }

  static final class ThreadLocalRandomGenerator implements RandomGenerator {

    @Override
    public long nextLong() {
      return ThreadLocalRandom.current().nextLong();
    }

    @Override
    public long nextLong(long bound) {
      return ThreadLocalRandom.current().nextLong(bound);
    }

    @Override
    public int nextInt(int bound) {
      return ThreadLocalRandom.current().nextInt(bound);
    }

    @Override
    public double nextDouble() {
      return ThreadLocalRandom.current().nextDouble();
    }
  }
}
