/*
 * どこで: Milestone アプリのインフラ設定
 * 何を: リアルタイムのマイルストーンハンドラを実行する有界 Executor を提供する
 * なぜ: イベントの集中で無制限に処理が増えたり、遅いハンドラがリスナーを止めたりしないようにするため
 */
package com.example.milestone.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class MilestoneListenerConfig {

  /**
   * キューが満杯のときはリスナースレッド自身がハンドラを実行する。その間はチャネルの読み取りが
   * 抑えられ、通知は PostgreSQL 側の接続上でバッファされ続ける。
   */
  @Bean
  public ThreadPoolTaskExecutor milestoneHandlerExecutor(MilestoneListenerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.handlerPoolSize());
    executor.setMaxPoolSize(properties.handlerPoolSize());
    executor.setQueueCapacity(properties.handlerQueueCapacity());
    executor.setThreadNamePrefix("milestone-handler-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    // シャットダウン時も送信中の処理は中断しない
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
