/*
 * どこで: Milestone リアルタイムリスナー
 * 何を: マイルストーンイベントをエンティティのフォロワーへ直接プッシュする
 * なぜ: 永続キューと夜間抑止の予約を経由しない低遅延経路のため
 */
package com.example.milestone.listener;

import com.example.common.TraceIds;
import com.example.common.event.MilestoneEvent;
import com.example.milestone.config.NotificationDeliveryProperties;
import com.example.milestone.model.DispatchResult;
import com.example.milestone.model.EntityType;
import com.example.milestone.model.Follower;
import com.example.milestone.push.PushSender;
import com.example.milestone.service.FollowerLookupService;
import com.example.milestone.service.MessageComposer;
import com.example.milestone.service.NotificationMetrics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MilestoneEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(MilestoneEventHandler.class);

  private final FollowerLookupService lookupService;
  private final PushSender pushSender;
  private final NotificationDeliveryProperties deliveryProperties;
  private final NotificationMetrics metrics;

  /**
   * フォロワーを解決し、1 人ずつ個別に送信する。有効なトークンを持たないフォロワーは飛ばす。
   * 何も永続化せず、再送もしない。
   */
  public DispatchResult handle(MilestoneEvent event) {
    return TraceIds.withNewTraceId(() -> dispatch(event));
  }

  private DispatchResult dispatch(MilestoneEvent event) {
    final EntityType entityType = EntityType.fromDbValue(event.entityType());
    final List<Follower> followers;
    try {
      followers = lookupService.getFollowers(entityType, event.entityId(), event.sport());
    } catch (DataAccessException ex) {
      logger.warn(
          "follower lookup failed for milestone entityType={} entityId={}",
          event.entityType(),
          event.entityId(),
          ex);
      return DispatchResult.EMPTY;
    }
    if (followers.isEmpty()) {
      return DispatchResult.EMPTY;
    }

    final String entityName =
        lookupService.getEntityName(entityType, event.entityId(), event.sport());
    final String statDisplayName =
        lookupService.getStatDisplayName(event.sport(), event.statKey(), entityType);
    final String message = MessageComposer.compose(entityName, statDisplayName, event.percentile());
    final Map<String, String> data = pushData(event, entityType);

    int sent = 0;
    int failed = 0;
    for (Follower follower : followers) {
      final List<String> tokens;
      try {
        tokens = lookupService.getDeviceTokens(follower.userId());
      } catch (DataAccessException ex) {
        logger.warn("device token lookup failed userId={}", follower.userId(), ex);
        continue;
      }
      if (tokens.isEmpty()) {
        continue;
      }
      try {
        pushSender.sendMulti(tokens, deliveryProperties.title(), message, data);
        sent++;
      } catch (RuntimeException ex) {
        logger.warn("milestone send failed userId={}", follower.userId(), ex);
        failed++;
      }
    }

    if (sent + failed > 0) {
      logger.info(
          "milestone notifications dispatched message={} sent={} failed={}", message, sent, failed);
    }
    metrics.recordDelivery(NotificationMetrics.PATH_REALTIME, sent, failed);
    return new DispatchResult(sent, failed);
  }

  private Map<String, String> pushData(MilestoneEvent event, EntityType entityType) {
    return Map.of(
        "entity_type", entityType.dbValue(),
        "entity_id", String.valueOf(event.entityId()),
        "sport", event.sport(),
        "stat_key", event.statKey(),
        "percentile", String.format(Locale.ROOT, "%.1f", event.percentile()));
  }
}
