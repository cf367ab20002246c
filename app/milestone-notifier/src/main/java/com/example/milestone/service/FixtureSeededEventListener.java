/*
 * どこで: Milestone サービス層
 * 何を: 取り込み側が fixture の投入完了を通知したら通知パイプラインを実行する
 * なぜ: 通知の失敗で、その契機になった投入処理を失敗させないため
 */
package com.example.milestone.service;

import com.example.milestone.model.PipelineResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FixtureSeededEventListener {

  private static final Logger logger = LoggerFactory.getLogger(FixtureSeededEventListener.class);

  private final NotificationPipeline pipeline;

  @EventListener
  public void onFixtureSeeded(FixtureSeededEvent event) {
    try {
      final PipelineResult result = pipeline.run(event.fixtureId());
      logger.debug(
          "notification pipeline finished fixtureId={} changes={} scheduled={}",
          result.fixtureId(),
          result.changeCount(),
          result.scheduledCount());
    } catch (RuntimeException ex) {
      logger.warn("notification pipeline failed fixtureId={}", event.fixtureId(), ex);
    }
  }
}
