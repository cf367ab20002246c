package com.example.milestone.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceTokenRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<String> findActiveTokens(String userId) {
    final String sql =
        """
        SELECT token
        FROM user_devices
        WHERE user_id = :userId::uuid
          AND is_active = true
        ORDER BY id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }
}
