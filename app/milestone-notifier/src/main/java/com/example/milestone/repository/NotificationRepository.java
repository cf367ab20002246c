/*
 * どこで: Milestone データアクセス
 * 何を: notifications テーブルの挿入、確保、状態遷移を行う
 * なぜ: 確保の SQL が配信ワーカー間で唯一の同時実行制御点であるため
 */
package com.example.milestone.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.milestone.model.EntityType;
import com.example.milestone.model.NotificationRecord;
import com.example.milestone.model.NotificationStatus;
import com.example.milestone.model.ScheduledNotification;
import com.google.common.annotations.VisibleForTesting;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      id, user_id::text AS user_id_text, entity_type, entity_id, sport, fixture_id, stat_key,
      percentile, message, status, scheduled_for, sent_at, last_error, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(ScheduledNotification notification, Instant now) {
    final String sql =
        """
        INSERT INTO notifications (
          user_id,
          entity_type,
          entity_id,
          sport,
          fixture_id,
          stat_key,
          percentile,
          message,
          status,
          scheduled_for,
          created_at,
          updated_at
        ) VALUES (
          :userId::uuid,
          :entityType,
          :entityId,
          :sport,
          :fixtureId,
          :statKey,
          :percentile,
          :message,
          'scheduled',
          :scheduledFor,
          :now,
          :now
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", notification.userId())
            .addValue("entityType", notification.entityType().dbValue())
            .addValue("entityId", notification.entityId())
            .addValue("sport", notification.sport())
            .addValue("fixtureId", notification.fixtureId())
            .addValue("statKey", notification.statKey())
            .addValue("percentile", notification.percentile())
            .addValue("message", notification.message())
            .addValue("scheduledFor", toTimestamp(notification.scheduledFor()))
            .addValue("now", toTimestamp(now));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notification insert returned no id");
    }
    return id;
  }

  /**
   * 1 行ずつ挿入する。バッチはトランザクションにしない。最初に失敗した行で残りを打ち切り、
   * それまでに書いた行はコミットされたまま残る。
   *
   * @return 挿入した行数
   * @throws NotificationPersistenceException 行の挿入に失敗したとき(途中までの件数を保持する)
   */
  public int insertAll(List<ScheduledNotification> notifications, Instant now) {
    int inserted = 0;
    for (ScheduledNotification notification : notifications) {
      try {
        insert(notification, now);
      } catch (DataAccessException ex) {
        throw new NotificationPersistenceException(inserted, ex);
      }
      inserted++;
    }
    return inserted;
  }

  /**
   * 期限の来た行を最大 {@code limit} 件、1 文で scheduled から sending へ進める。並行する確保側が
   * ロック中の行は飛ばすので、並行呼び出しは待たずに互いに素な集合を受け取る。
   */
  public List<NotificationRecord> claimDue(int limit, Instant now) {
    final String sql =
        """
        UPDATE notifications n
        SET status = 'sending',
            updated_at = :now
        WHERE n.id IN (
          SELECT id
          FROM notifications
          WHERE status = 'scheduled'
            AND scheduled_for <= :now
          ORDER BY scheduled_for
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        RETURNING n.id, n.user_id::text AS user_id_text, n.entity_type, n.entity_id, n.sport,
                  n.fixture_id, n.stat_key, n.percentile, n.message, n.status, n.scheduled_for,
                  n.sent_at, n.last_error, n.created_at, n.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(long id, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'sent',
            sent_at = :sentAt,
            updated_at = :sentAt
        WHERE id = :id
          AND status = 'sending'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(long id, String reason, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'failed',
            last_error = :reason,
            updated_at = :now
        WHERE id = :id
          AND status = 'sending'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @VisibleForTesting
  public Optional<NotificationRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM notifications WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @VisibleForTesting
  public List<NotificationRecord> findByUserId(String userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM notifications WHERE user_id = :userId::uuid ORDER BY created_at DESC, id DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long fixtureIdValue = rs.getLong("fixture_id");
    final Long fixtureId = rs.wasNull() ? null : fixtureIdValue;
    return new NotificationRecord(
        rs.getLong("id"),
        rs.getString("user_id_text"),
        EntityType.fromDbValue(rs.getString("entity_type")),
        rs.getLong("entity_id"),
        rs.getString("sport"),
        fixtureId,
        rs.getString("stat_key"),
        rs.getDouble("percentile"),
        rs.getString("message"),
        NotificationStatus.fromDbValue(rs.getString("status")),
        toInstant(rs.getTimestamp("scheduled_for")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
