/*
 * Where: scheduler service layer
 * What: folds a commit's check runs into one pass/fail/pending status
 * Why: the cached pull request row stores a single status per head commit
 */
package com.example.scheduler.service;

import com.example.scheduler.model.CheckRun;
import com.example.scheduler.model.ChecksStatus;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class CheckAggregator {

  private static final String STATUS_COMPLETED = "completed";
  private static final Set<String> FAILING_CONCLUSIONS =
      Set.of("failure", "cancelled", "timed_out", "action_required");

  /** Any failing run wins over pending; a commit without runs counts as passing. */
  public ChecksStatus aggregate(List<CheckRun> checkRuns) {
    if (checkRuns == null || checkRuns.isEmpty()) {
      return ChecksStatus.PASS;
    }
    boolean pending = false;
    for (CheckRun run : checkRuns) {
      if (run == null) {
        continue;
      }
      if (isFailing(run)) {
        return ChecksStatus.FAIL;
      }
      if (isPending(run)) {
        pending = true;
      }
    }
    return pending ? ChecksStatus.PENDING : ChecksStatus.PASS;
  }

  private boolean isFailing(CheckRun run) {
    return run.conclusion() != null && FAILING_CONCLUSIONS.contains(run.conclusion());
  }

  private boolean isPending(CheckRun run) {
    return !STATUS_COMPLETED.equals(run.status()) || run.conclusion() == null;
  }
}
