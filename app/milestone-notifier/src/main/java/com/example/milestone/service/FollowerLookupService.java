/*
 * どこで: Milestone サービス層
 * 何を: フォロワー、表示名、試合時刻、端末トークンを解決する
 * なぜ: どの参照が縮退してよく、どれが実行全体にとって致命的かを一箇所で決めるため
 */
package com.example.milestone.service;

import com.example.milestone.model.EntityType;
import com.example.milestone.model.Follower;
import com.example.milestone.repository.DeviceTokenRepository;
import com.example.milestone.repository.EntityLookupRepository;
import com.example.milestone.repository.FollowerRepository;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FollowerLookupService {

  private static final Logger logger = LoggerFactory.getLogger(FollowerLookupService.class);

  private final FollowerRepository followerRepository;
  private final EntityLookupRepository entityLookupRepository;
  private final DeviceTokenRepository deviceTokenRepository;

  /** エンティティのフォロワー。誰もフォローしていなければ空。クエリ失敗はそのまま伝播する。 */
  public List<Follower> getFollowers(EntityType entityType, long entityId, String sport) {
    return followerRepository.findFollowers(entityType, entityId, sport);
  }

  /** エンティティの表示名。参照に失敗したか見つからなければ id の文字列を返す。 */
  public String getEntityName(EntityType entityType, long entityId, String sport) {
    final String fallback = String.valueOf(entityId);
    try {
      return entityLookupRepository.findEntityName(entityType, entityId, sport).orElse(fallback);
    } catch (DataAccessException ex) {
      logger.warn(
          "entity name lookup failed entityType={} entityId={} sport={}",
          entityType.dbValue(),
          entityId,
          sport,
          ex);
      return fallback;
    }
  }

  /** 人が読めるスタッツ名。参照に失敗したか見つからなければスタッツキーをそのまま返す。 */
  public String getStatDisplayName(String sport, String statKey, EntityType entityType) {
    try {
      return entityLookupRepository.findStatDisplayName(sport, statKey, entityType).orElse(statKey);
    } catch (DataAccessException ex) {
      logger.warn("stat display name lookup failed sport={} statKey={}", sport, statKey, ex);
      return statKey;
    }
  }

  /**
   * @throws MatchTimeUnavailableException fixture が存在しないかクエリが失敗したとき
   */
  public Instant getMatchTime(long fixtureId) {
    try {
      return entityLookupRepository
          .findFixtureStartTime(fixtureId)
          .orElseThrow(() -> new MatchTimeUnavailableException(fixtureId));
    } catch (DataAccessException ex) {
      throw new MatchTimeUnavailableException(fixtureId, ex);
    }
  }

  public List<String> getDeviceTokens(String userId) {
    return deviceTokenRepository.findActiveTokens(userId);
  }
}
