/*
 * どこで: Milestone サービス層
 * 何を: 検出したパーセンタイル変化から予約済み通知行までのバッチ経路
 * なぜ: fixture のスタッツとパーセンタイルが再計算されるたびに 1 回呼ばれるため
 */
package com.example.milestone.service;

import com.example.milestone.model.Change;
import com.example.milestone.model.Follower;
import com.example.milestone.model.PipelineResult;
import com.example.milestone.model.ScheduledNotification;
import com.example.milestone.repository.NotificationPersistenceException;
import com.example.milestone.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPipeline {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPipeline.class);
  private static final String MDC_FIXTURE_ID = "fixture_id";

  private final ChangeDetector changeDetector;
  private final FollowerLookupService lookupService;
  private final DeliveryScheduler deliveryScheduler;
  private final NotificationRepository notificationRepository;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * fixture の有意な変化を検出し、フォロワーごとに個別の配信時刻を付けてファンアウトし、
   * scheduled として挿入する。
   *
   * @throws ChangeDetectionException 差分の取得に失敗したとき
   * @throws MatchTimeUnavailableException fixture の開始時刻を解決できないとき
   * @throws NotificationPersistenceException 挿入に失敗したとき(それ以前の行はコミット済み)
   */
  public PipelineResult run(long fixtureId) {
    MDC.put(MDC_FIXTURE_ID, String.valueOf(fixtureId));
    try {
      final List<Change> changes = changeDetector.detect(fixtureId);
      if (changes.isEmpty()) {
        logger.info("no significant percentile changes fixtureId={}", fixtureId);
        return PipelineResult.noChanges(fixtureId);
      }
      logger.info("detected percentile changes fixtureId={} count={}", fixtureId, changes.size());

      final Instant matchTime = lookupService.getMatchTime(fixtureId);
      final List<ScheduledNotification> pending = fanOut(fixtureId, changes, matchTime);
      if (pending.isEmpty()) {
        logger.info("no followers to notify fixtureId={}", fixtureId);
        return new PipelineResult(fixtureId, changes.size(), 0);
      }

      final int inserted = persist(pending);
      logger.info("notifications scheduled fixtureId={} count={}", fixtureId, inserted);
      return new PipelineResult(fixtureId, changes.size(), inserted);
    } finally {
      MDC.remove(MDC_FIXTURE_ID);
    }
  }

  private List<ScheduledNotification> fanOut(long fixtureId, List<Change> changes, Instant matchTime) {
    final List<ScheduledNotification> pending = new ArrayList<>();
    for (Change change : changes) {
      final List<Follower> followers;
      try {
        followers = lookupService.getFollowers(change.entityType(), change.entityId(), change.sport());
      } catch (DataAccessException ex) {
        logger.warn(
            "follower lookup failed, skipping change entityType={} entityId={} statKey={}",
            change.entityType().dbValue(),
            change.entityId(),
            change.statKey(),
            ex);
        continue;
      }
      if (followers.isEmpty()) {
        continue;
      }

      // メッセージは変化ごとに 1 つ作り、そのフォロワー全員で共有する
      final String entityName =
          lookupService.getEntityName(change.entityType(), change.entityId(), change.sport());
      final String statDisplayName =
          lookupService.getStatDisplayName(change.sport(), change.statKey(), change.entityType());
      final String message = MessageComposer.compose(entityName, statDisplayName, change);

      for (Follower follower : followers) {
        pending.add(
            new ScheduledNotification(
                follower.userId(),
                change.entityType(),
                change.entityId(),
                change.sport(),
                fixtureId,
                change.statKey(),
                change.newPercentile(),
                message,
                deliveryScheduler.scheduleDelivery(matchTime, follower.timezone())));
      }
    }
    return pending;
  }

  private int persist(List<ScheduledNotification> pending) {
    try {
      final int inserted = notificationRepository.insertAll(pending, Instant.now(clock));
      metrics.recordScheduled(inserted);
      return inserted;
    } catch (NotificationPersistenceException ex) {
      metrics.recordScheduled(ex.insertedCount());
      throw ex;
    }
  }
}
