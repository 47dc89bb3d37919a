/*
 * Where: scheduler data access
 * What: deletes, inserts and reads the cached_pull_requests snapshot of a schedule
 * Why: the web UI renders the last fetched pull requests from this table
 */
package com.example.scheduler.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.scheduler.model.CachedPullRequest;
import com.example.scheduler.model.ChecksStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CachedPullRequestRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int deleteByScheduleId(String scheduleId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.update(
        "DELETE FROM cached_pull_requests WHERE schedule_id = :scheduleId", params);
  }

  public int insertAll(List<CachedPullRequest> rows) {
    if (rows.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO cached_pull_requests (
          id,
          schedule_id,
          organization,
          repository,
          pr_number,
          title,
          author,
          author_avatar_url,
          labels,
          checks_status,
          html_url,
          created_at,
          cached_at
        ) VALUES (
          :id,
          :scheduleId,
          :organization,
          :repository,
          :prNumber,
          :title,
          :author,
          :authorAvatarUrl,
          :labels,
          :checksStatus,
          :htmlUrl,
          :createdAt,
          :cachedAt
        )
        """;
    final MapSqlParameterSource[] batch =
        rows.stream().map(this::toParams).toArray(MapSqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(sql, batch);
    return counts.length;
  }

  public List<CachedPullRequest> findByScheduleId(String scheduleId) {
    final String sql =
        """
        SELECT id, schedule_id, organization, repository, pr_number, title, author,
               author_avatar_url, labels, checks_status, html_url, created_at, cached_at
        FROM cached_pull_requests
        WHERE schedule_id = :scheduleId
        ORDER BY organization, repository, pr_number
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource toParams(CachedPullRequest row) {
    return new MapSqlParameterSource()
        .addValue("id", row.id())
        .addValue("scheduleId", row.scheduleId())
        .addValue("organization", row.organization())
        .addValue("repository", row.repository())
        .addValue("prNumber", row.prNumber())
        .addValue("title", row.title())
        .addValue("author", row.author())
        .addValue("authorAvatarUrl", row.authorAvatarUrl())
        .addValue("labels", row.labelsJson())
        .addValue("checksStatus", row.checksStatus().value())
        .addValue("htmlUrl", row.htmlUrl())
        .addValue("createdAt", toTimestamp(row.createdAt()))
        .addValue("cachedAt", toTimestamp(row.cachedAt()));
  }

  private CachedPullRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CachedPullRequest(
        rs.getString("id"),
        rs.getString("schedule_id"),
        rs.getString("organization"),
        rs.getString("repository"),
        rs.getInt("pr_number"),
        rs.getString("title"),
        rs.getString("author"),
        rs.getString("author_avatar_url"),
        rs.getString("labels"),
        ChecksStatus.fromValue(rs.getString("checks_status")),
        rs.getString("html_url"),
        getInstant(rs, "created_at"),
        getInstant(rs, "cached_at"));
  }
}
