/*
 * Where: scheduler service layer
 * What: ScheduleStore over PostgreSQL, decrypting tokens and replacing snapshots in one transaction
 * Why: readers of cached_pull_requests must never observe a half-replaced snapshot
 */
package com.example.scheduler.service;

import com.example.common.RunIds;
import com.example.scheduler.crypto.TokenCipher;
import com.example.scheduler.crypto.TokenDecryptionException;
import com.example.scheduler.model.CachedPullRequest;
import com.example.scheduler.model.NotificationSchedule;
import com.example.scheduler.model.OpenPullRequest;
import com.example.scheduler.model.RepositoryRef;
import com.example.scheduler.model.StoredSchedule;
import com.example.scheduler.repository.CachedPullRequestRepository;
import com.example.scheduler.repository.NotificationScheduleRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class JdbcScheduleStore implements ScheduleStore {

  private static final Logger logger = LoggerFactory.getLogger(JdbcScheduleStore.class);

  private final NotificationScheduleRepository scheduleRepository;
  private final CachedPullRequestRepository cachedPullRequestRepository;
  private final TokenCipher tokenCipher;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public List<NotificationSchedule> listActiveSchedules() {
    final List<StoredSchedule> rows = scheduleRepository.findActive();
    final Map<String, List<RepositoryRef>> repositories =
        scheduleRepository.findRepositoriesByScheduleIds(
            rows.stream().map(StoredSchedule::id).toList());
    final List<NotificationSchedule> schedules = new ArrayList<>(rows.size());
    for (StoredSchedule row : rows) {
      decrypt(row)
          .map(pat -> toSchedule(row, pat, repositories.getOrDefault(row.id(), List.of())))
          .ifPresent(schedules::add);
    }
    return schedules;
  }

  @Override
  public List<String> listAllScheduleIds() {
    return scheduleRepository.findAllIds();
  }

  @Override
  public Optional<NotificationSchedule> getScheduleById(String scheduleId) {
    final Optional<StoredSchedule> row = scheduleRepository.findById(scheduleId);
    if (row.isEmpty()) {
      return Optional.empty();
    }
    final StoredSchedule stored = row.get();
    return decrypt(stored)
        .map(
            pat ->
                toSchedule(
                    stored,
                    pat,
                    scheduleRepository
                        .findRepositoriesByScheduleIds(List.of(scheduleId))
                        .getOrDefault(scheduleId, List.of())));
  }

  @Override
  public void replaceCachedPullRequests(String scheduleId, List<OpenPullRequest> pullRequests) {
    final Instant cachedAt = clock.instant();
    final List<CachedPullRequest> rows =
        pullRequests.stream().map(pr -> toCachedRow(scheduleId, pr, cachedAt)).toList();
    transactionTemplate.executeWithoutResult(
        status -> {
          final int deleted = cachedPullRequestRepository.deleteByScheduleId(scheduleId);
          final int inserted = cachedPullRequestRepository.insertAll(rows);
          logger.info(
              "cached pull requests replaced scheduleId={} deleted={} inserted={}",
              scheduleId,
              deleted,
              inserted);
        });
  }

  @Override
  public List<CachedPullRequest> findCachedPullRequests(String scheduleId) {
    return cachedPullRequestRepository.findByScheduleId(scheduleId);
  }

  private Optional<String> decrypt(StoredSchedule row) {
    try {
      return Optional.of(tokenCipher.decrypt(row.encryptedPat()));
    } catch (TokenDecryptionException ex) {
      logger.error(
          "failed to decrypt github token; schedule ignored scheduleId={} reason={}",
          row.id(),
          ex.getMessage());
      return Optional.empty();
    }
  }

  private NotificationSchedule toSchedule(
      StoredSchedule row, String pat, List<RepositoryRef> repositories) {
    return new NotificationSchedule(
        row.id(),
        row.userId(),
        row.name(),
        row.cronExpression(),
        pat,
        row.active(),
        row.userEmail(),
        repositories);
  }

  private CachedPullRequest toCachedRow(String scheduleId, OpenPullRequest pr, Instant cachedAt) {
    return new CachedPullRequest(
        RunIds.newId(),
        scheduleId,
        pr.organization(),
        pr.repository(),
        pr.number(),
        Objects.requireNonNullElse(pr.title(), ""),
        pr.author(),
        pr.authorAvatarUrl(),
        toJson(pr.labels()),
        pr.checksStatus(),
        Objects.requireNonNullElse(pr.htmlUrl(), ""),
        pr.createdAt() == null ? cachedAt : pr.createdAt(),
        cachedAt);
  }

  private String toJson(List<String> labels) {
    try {
      return objectMapper.writeValueAsString(labels);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("labels serialization failed", ex);
    }
  }
}
