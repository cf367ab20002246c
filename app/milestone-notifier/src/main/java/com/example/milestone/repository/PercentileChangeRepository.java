/*
 * どこで: Milestone データアクセス
 * 何を: fixture の全参加者について新旧パーセンタイルの組を読む
 * なぜ: 比較はパーセンタイルエンジンが持つ DB 関数で計算されるため
 */
package com.example.milestone.repository;

import com.example.milestone.model.Change;
import com.example.milestone.model.EntityType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PercentileChangeRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 有意かどうかにかかわらず、fixture の差分行をすべて返す。 */
  public List<Change> findByFixtureId(long fixtureId) {
    final String sql =
        """
        SELECT entity_type, entity_id, sport, season, league_id, stat_key,
               old_percentile, new_percentile, sample_size
        FROM detect_percentile_changes(:fixtureId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("fixtureId", Math.toIntExact(fixtureId));
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> mapRow(rs, fixtureId));
  }

  private Change mapRow(ResultSet rs, long fixtureId) throws SQLException {
    return new Change(
        fixtureId,
        EntityType.fromDbValue(rs.getString("entity_type")),
        rs.getLong("entity_id"),
        rs.getString("sport"),
        rs.getInt("season"),
        rs.getLong("league_id"),
        rs.getString("stat_key"),
        rs.getObject("old_percentile", Double.class),
        rs.getDouble("new_percentile"),
        rs.getInt("sample_size"));
  }
}
