/*
 * どこで: Milestone 配信ワーカー
 * 何を: 一定間隔で配信バッチを起動する
 * なぜ: 予約済み通知は時間とともに期限を迎え、定期的に拾う必要があるため
 */
package com.example.milestone.service;

import com.example.milestone.model.DispatchResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDispatchWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchWorker.class);

  private final NotificationDispatchService dispatchService;

  @Scheduled(fixedDelayString = "${notification.delivery.poll-interval}")
  public void run() {
    try {
      final DispatchResult result = dispatchService.dispatchBatch();
      if (!result.isEmpty()) {
        logger.info("dispatch batch sent={} failed={}", result.sent(), result.failed());
      }
    } catch (DataAccessException ex) {
      logger.error("dispatch error", ex);
    }
  }
}
