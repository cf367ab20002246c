/*
 * どこで: Milestone サービス層
 * 何を: 期限の来た通知を確保し、ユーザーの端末へプッシュする
 * なぜ: 確保した各行を sent か failed の終端状態まで進めるため
 */
package com.example.milestone.service;

import com.example.milestone.config.NotificationDeliveryProperties;
import com.example.milestone.model.DispatchResult;
import com.example.milestone.model.NotificationRecord;
import com.example.milestone.push.PushSender;
import com.example.milestone.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

  static final String NO_DEVICE_TOKENS = "no device tokens";

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);

  private final NotificationRepository notificationRepository;
  private final FollowerLookupService lookupService;
  private final PushSender pushSender;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * 期限の来た行を最大 {@code batch-size} 件確保して 1 件ずつ送信する。送信失敗は行に記録し、
   * 再送しない。
   *
   * @throws DataAccessException 確保そのものが失敗したとき
   */
  public DispatchResult dispatchBatch() {
    // 確保は 1 文で完結するため、送信をまたぐトランザクションは張らない
    final List<NotificationRecord> claimed =
        notificationRepository.claimDue(properties.batchSize(), Instant.now(clock));
    int sent = 0;
    int failed = 0;
    for (NotificationRecord record : claimed) {
      final List<String> tokens = resolveTokens(record.userId());
      if (tokens.isEmpty()) {
        logger.warn("no device tokens notificationId={} userId={}", record.id(), record.userId());
        fail(record, NO_DEVICE_TOKENS);
        failed++;
        continue;
      }
      try {
        pushSender.sendMulti(tokens, properties.title(), record.message(), pushData(record));
      } catch (RuntimeException ex) {
        logger.warn("send failed notificationId={} userId={}", record.id(), record.userId(), ex);
        fail(record, truncateError(ex.getMessage()));
        failed++;
        continue;
      }
      complete(record);
      sent++;
    }
    metrics.recordDelivery(NotificationMetrics.PATH_BATCH, sent, failed);
    return new DispatchResult(sent, failed);
  }

  private List<String> resolveTokens(String userId) {
    try {
      return lookupService.getDeviceTokens(userId);
    } catch (DataAccessException ex) {
      logger.warn("device token lookup failed userId={}", userId, ex);
      return List.of();
    }
  }

  private void complete(NotificationRecord record) {
    try {
      final int updated = notificationRepository.markSent(record.id(), Instant.now(clock));
      if (updated == 0) {
        logger.warn("notification sent but row was no longer sending id={}", record.id());
      }
    } catch (DataAccessException ex) {
      logger.error("mark sent failed id={}", record.id(), ex);
    }
  }

  private void fail(NotificationRecord record, String reason) {
    try {
      final int updated = notificationRepository.markFailed(record.id(), reason, Instant.now(clock));
      if (updated == 0) {
        logger.warn("mark failed skipped because row was no longer sending id={}", record.id());
      }
    } catch (DataAccessException ex) {
      logger.error("mark failed failed id={} reason={}", record.id(), reason, ex);
    }
  }

  private Map<String, String> pushData(NotificationRecord record) {
    return Map.of(
        "entity_type", record.entityType().dbValue(),
        "entity_id", String.valueOf(record.entityId()),
        "sport", record.sport());
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
