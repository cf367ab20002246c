/*
 * どこで: Milestone データアクセス
 * 何を: エンティティのフォロワーをタイムゾーンとあわせて読む
 * なぜ: ファンアウトで各フォロワーの活動時間帯に合わせて配信を予約するため
 */
package com.example.milestone.repository;

import com.example.milestone.model.EntityType;
import com.example.milestone.model.Follower;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class FollowerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Follower> findFollowers(EntityType entityType, long entityId, String sport) {
    final String sql =
        """
        SELECT uf.user_id::text AS user_id_text, u.timezone
        FROM user_follows uf
        JOIN users u ON u.id = uf.user_id
        WHERE uf.entity_type = :entityType
          AND uf.entity_id = :entityId
          AND uf.sport = :sport
        ORDER BY uf.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entityType", entityType.dbValue())
            .addValue("entityId", entityId)
            .addValue("sport", sport);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new Follower(rs.getString("user_id_text"), rs.getString("timezone")));
  }
}
