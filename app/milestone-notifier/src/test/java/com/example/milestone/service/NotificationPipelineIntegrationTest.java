/*
 * どこで: Milestone パイプラインの統合テスト
 * 何を: 他コンポーネントのテーブルをスタブにして、PostgreSQL 上でバッチ経路を通しで実行する
 * なぜ: 検出、フォロワー参照、挿入の SQL をまとめて確認するため
 */
package com.example.milestone.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.milestone.AbstractPostgresContainerTest;
import com.example.milestone.model.EntityType;
import com.example.milestone.model.NotificationRecord;
import com.example.milestone.model.NotificationStatus;
import com.example.milestone.model.PipelineResult;
import com.example.milestone.repository.NotificationRepository;
import com.example.milestone.test.fixtures.MilestoneFixtures;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationPipelineIntegrationTest extends AbstractPostgresContainerTest {

  private static final long FIXTURE_ID = 7L;
  private static final long TEAM_ID = 42L;

  @Autowired private NotificationPipeline pipeline;

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private ApplicationEventPublisher eventPublisher;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private MilestoneFixtures fixtures;
  private Instant matchTime;

  @BeforeEach
  void setUp() {
    fixtures = new MilestoneFixtures(jdbcTemplate);
    fixtures.deleteAll();
    matchTime = Instant.now().minus(3, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
    fixtures.fixture(FIXTURE_ID, matchTime);
    fixtures.team(TEAM_ID, "Arsenal");
    fixtures.statDefinition("goals", EntityType.TEAM, "Goals");
  }

  @Test
  void milestoneCrossingSchedulesOneRowForTheFollower() {
    final String userId = fixtures.user("America/New_York");
    fixtures.follow(userId, EntityType.TEAM, TEAM_ID);
    fixtures.percentileChange(FIXTURE_ID, EntityType.TEAM, TEAM_ID, "goals", 88.0d, 91.0d);

    final PipelineResult result = pipeline.run(FIXTURE_ID);

    assertThat(result).isEqualTo(new PipelineResult(FIXTURE_ID, 1, 1));
    final List<NotificationRecord> rows = notificationRepository.findByUserId(userId);
    assertThat(rows).hasSize(1);
    final NotificationRecord row = rows.get(0);
    assertThat(row.status()).isEqualTo(NotificationStatus.SCHEDULED);
    assertThat(row.message()).isEqualTo("Arsenal is now 91st percentile in Goals");
    assertThat(row.entityType()).isEqualTo(EntityType.TEAM);
    assertThat(row.entityId()).isEqualTo(TEAM_ID);
    assertThat(row.fixtureId()).isEqualTo(FIXTURE_ID);
    assertThat(row.statKey()).isEqualTo("goals");
    assertThat(row.percentile()).isEqualTo(91.0d);
    assertThat(row.scheduledFor()).isAfterOrEqualTo(matchTime);
    final int localHour = row.scheduledFor().atZone(ZoneId.of("America/New_York")).getHour();
    assertThat(localHour).isBetween(9, 21);
  }

  @Test
  void insignificantMovesScheduleNothing() {
    final String userId = fixtures.user("UTC");
    fixtures.follow(userId, EntityType.TEAM, TEAM_ID);
    fixtures.percentileChange(FIXTURE_ID, EntityType.TEAM, TEAM_ID, "goals", 50.0d, 55.0d);

    final PipelineResult result = pipeline.run(FIXTURE_ID);

    assertThat(result).isEqualTo(PipelineResult.noChanges(FIXTURE_ID));
    assertThat(notificationRepository.findByUserId(userId)).isEmpty();
  }

  @Test
  void statsWithoutPreviousPercentileScheduleNothing() {
    final String userId = fixtures.user("UTC");
    fixtures.follow(userId, EntityType.TEAM, TEAM_ID);
    fixtures.percentileChange(FIXTURE_ID, EntityType.TEAM, TEAM_ID, "goals", null, 12.0d);
    fixtures.percentileChange(FIXTURE_ID, EntityType.TEAM, TEAM_ID, "assists", null, 93.0d);

    assertThat(pipeline.run(FIXTURE_ID).scheduledCount()).isZero();
    assertThat(notificationRepository.findByUserId(userId)).isEmpty();
  }

  @Test
  void unknownFixtureFailsOnceChangesExist() {
    fixtures.percentileChange(99L, EntityType.TEAM, TEAM_ID, "goals", 88.0d, 91.0d);

    assertThatThrownBy(() -> pipeline.run(99L)).isInstanceOf(MatchTimeUnavailableException.class);
  }

  @Test
  void seededEventRunsThePipelineAndSwallowsFailures() {
    final String userId = fixtures.user("Europe/London");
    fixtures.follow(userId, EntityType.TEAM, TEAM_ID);
    fixtures.percentileChange(FIXTURE_ID, EntityType.TEAM, TEAM_ID, "goals", 94.0d, 96.0d);
    fixtures.percentileChange(99L, EntityType.TEAM, TEAM_ID, "goals", 88.0d, 91.0d);

    eventPublisher.publishEvent(new FixtureSeededEvent(FIXTURE_ID));
    eventPublisher.publishEvent(new FixtureSeededEvent(99L));

    assertThat(notificationRepository.findByUserId(userId))
        .extracting(NotificationRecord::message)
        .containsExactly("Arsenal is now 96th percentile in Goals");
  }
}
