/*
 * Where: scheduler data access
 * What: reads notification_schedules with their owner's email and their target repositories
 * Why: the reconciler and the job executor only ever read schedules; the web API owns writes
 */
package com.example.scheduler.repository;

import com.example.scheduler.model.RepositoryRef;
import com.example.scheduler.model.StoredSchedule;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationScheduleRepository {

  private static final String SELECT_SCHEDULE =
      """
      SELECT s.id, s.user_id, s.name, s.cron_expression, s.github_pat, s.is_active,
             u.email AS user_email
      FROM notification_schedules s
      LEFT JOIN users u ON u.id = s.user_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<StoredSchedule> findActive() {
    final String sql = SELECT_SCHEDULE + " WHERE s.is_active = TRUE ORDER BY s.created_at, s.id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapSchedule);
  }

  public Optional<StoredSchedule> findById(String scheduleId) {
    final String sql = SELECT_SCHEDULE + " WHERE s.id = :scheduleId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapSchedule).stream().findFirst();
  }

  public List<String> findAllIds() {
    return jdbcTemplate.queryForList(
        "SELECT id FROM notification_schedules", new MapSqlParameterSource(), String.class);
  }

  public Map<String, List<RepositoryRef>> findRepositoriesByScheduleIds(
      Collection<String> scheduleIds) {
    if (scheduleIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT schedule_id, organization, repository
        FROM schedule_repositories
        WHERE schedule_id IN (:scheduleIds)
        ORDER BY schedule_id, organization, repository
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleIds", scheduleIds);
    final Map<String, List<RepositoryRef>> result = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          result
              .computeIfAbsent(rs.getString("schedule_id"), ignored -> new ArrayList<>())
              .add(new RepositoryRef(rs.getString("organization"), rs.getString("repository")));
        });
    return result;
  }

  private StoredSchedule mapSchedule(ResultSet rs, int rowNum) throws SQLException {
    return new StoredSchedule(
        rs.getString("id"),
        rs.getString("user_id"),
        rs.getString("name"),
        rs.getString("cron_expression"),
        rs.getString("github_pat"),
        rs.getBoolean("is_active"),
        rs.getString("user_email"));
  }
}
