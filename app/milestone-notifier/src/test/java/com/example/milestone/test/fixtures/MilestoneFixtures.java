/*
 * どこで: Milestone テスト用フィクスチャ
 * 何を: 統合テスト向けにユーザー、フォロー、端末、他コンポーネントの行を挿入する
 * なぜ: テスト準備の SQL をテスト本体から切り離すため
 */
package com.example.milestone.test.fixtures;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.milestone.model.EntityType;
import com.example.milestone.model.ScheduledNotification;
import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class MilestoneFixtures {

  public static final String SPORT = "football";
  public static final int SEASON = 2025;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MilestoneFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public static ScheduledNotification scheduled(String userId, Instant scheduledFor) {
    return new ScheduledNotification(
        userId,
        EntityType.TEAM,
        42L,
        SPORT,
        7L,
        "goals",
        91.0d,
        "Arsenal is now 91st percentile in Goals",
        scheduledFor);
  }

  public void deleteAll() {
    final MapSqlParameterSource empty = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM notifications", empty);
    jdbcTemplate.update("DELETE FROM user_devices", empty);
    jdbcTemplate.update("DELETE FROM user_follows", empty);
    jdbcTemplate.update("DELETE FROM users", empty);
    jdbcTemplate.update("DELETE FROM percentile_change_stub", empty);
    jdbcTemplate.update("DELETE FROM stat_definitions", empty);
    jdbcTemplate.update("DELETE FROM players", empty);
    jdbcTemplate.update("DELETE FROM teams", empty);
    jdbcTemplate.update("DELETE FROM fixtures", empty);
  }

  public String user(String timezone) {
    final String userId = UUID.randomUUID().toString();
    jdbcTemplate.update(
        "INSERT INTO users (id, timezone) VALUES (:id::uuid, :timezone)",
        new MapSqlParameterSource().addValue("id", userId).addValue("timezone", timezone));
    return userId;
  }

  public void follow(String userId, EntityType entityType, long entityId) {
    jdbcTemplate.update(
        """
        INSERT INTO user_follows (user_id, entity_type, entity_id, sport)
        VALUES (:userId::uuid, :entityType, :entityId, :sport)
        """,
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("entityType", entityType.dbValue())
            .addValue("entityId", entityId)
            .addValue("sport", SPORT));
  }

  public void device(String userId, String token, boolean active) {
    jdbcTemplate.update(
        """
        INSERT INTO user_devices (user_id, platform, token, is_active)
        VALUES (:userId::uuid, 'ios', :token, :active)
        """,
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("token", token)
            .addValue("active", active));
  }

  public void fixture(long fixtureId, Instant startTime) {
    jdbcTemplate.update(
        "INSERT INTO fixtures (id, sport, start_time) VALUES (:id, :sport, :startTime)",
        new MapSqlParameterSource()
            .addValue("id", fixtureId)
            .addValue("sport", SPORT)
            .addValue("startTime", toTimestamp(startTime)));
  }

  public void team(long teamId, String name) {
    jdbcTemplate.update(
        "INSERT INTO teams (id, sport, name) VALUES (:id, :sport, :name)",
        new MapSqlParameterSource()
            .addValue("id", teamId)
            .addValue("sport", SPORT)
            .addValue("name", name));
  }

  public void statDefinition(String statKey, EntityType entityType, String displayName) {
    jdbcTemplate.update(
        """
        INSERT INTO stat_definitions (sport, key_name, entity_type, display_name)
        VALUES (:sport, :statKey, :entityType, :displayName)
        """,
        new MapSqlParameterSource()
            .addValue("sport", SPORT)
            .addValue("statKey", statKey)
            .addValue("entityType", entityType.dbValue())
            .addValue("displayName", displayName));
  }

  public void percentileChange(
      long fixtureId, EntityType entityType, long entityId, String statKey, Double from, double to) {
    jdbcTemplate.update(
        """
        INSERT INTO percentile_change_stub (
          fixture_id, entity_type, entity_id, sport, season, league_id, stat_key,
          old_percentile, new_percentile, sample_size
        ) VALUES (
          :fixtureId, :entityType, :entityId, :sport, :season, 8, :statKey, :from, :to, 20
        )
        """,
        new MapSqlParameterSource()
            .addValue("fixtureId", fixtureId)
            .addValue("entityType", entityType.dbValue())
            .addValue("entityId", entityId)
            .addValue("sport", SPORT)
            .addValue("season", SEASON)
            .addValue("statKey", statKey)
            .addValue("from", from == null ? null : from.floatValue())
            .addValue("to", (float) to));
  }
}
