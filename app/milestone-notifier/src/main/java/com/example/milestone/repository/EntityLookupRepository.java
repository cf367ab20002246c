/*
 * どこで: Milestone データアクセス
 * 何を: 他コンポーネントが持つ表示名、スタッツラベル、試合開始時刻を読む
 * なぜ: メッセージの組み立てと配信ウィンドウの起点に使う読み取り専用の参照のため
 */
package com.example.milestone.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;

import com.example.milestone.model.EntityType;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EntityLookupRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findEntityName(EntityType entityType, long entityId, String sport) {
    final String sql =
        switch (entityType) {
          case PLAYER -> "SELECT name FROM players WHERE id = :entityId AND sport = :sport";
          case TEAM -> "SELECT name FROM teams WHERE id = :entityId AND sport = :sport";
        };
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entityId", Math.toIntExact(entityId))
            .addValue("sport", sport);
    return jdbcTemplate.queryForList(sql, params, String.class).stream()
        .filter(Objects::nonNull)
        .findFirst();
  }

  public Optional<String> findStatDisplayName(String sport, String statKey, EntityType entityType) {
    final String sql =
        """
        SELECT display_name
        FROM stat_definitions
        WHERE sport = :sport
          AND key_name = :statKey
          AND entity_type = :entityType
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sport", sport)
            .addValue("statKey", statKey)
            .addValue("entityType", entityType.dbValue());
    return jdbcTemplate.queryForList(sql, params, String.class).stream()
        .filter(Objects::nonNull)
        .findFirst();
  }

  public Optional<Instant> findFixtureStartTime(long fixtureId) {
    final String sql = "SELECT start_time FROM fixtures WHERE id = :fixtureId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("fixtureId", Math.toIntExact(fixtureId));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> Optional.ofNullable(toInstant(rs.getTimestamp("start_time"))))
        .stream()
        .flatMap(Optional::stream)
        .findFirst();
  }
}
