package com.daveeberhart.db_util.secure_backup.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.storage.BackupArtifact;

/**
 * Prune the bucket: first everything older than the retention period, then the oldest backups
 * beyond the configured maximum count.
 */
public class RetentionJob extends Job {
  private static final Logger log = LoggerFactory.getLogger(RetentionJob.class);

  protected Clock clock = Clock.systemUTC();
  protected Integer retentionDays;
  protected Integer maxBackups;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (p_args.size() > 2) {
      throw new BadArgsException("Too many arguments for cleanup: " + p_args);
    }
    if (p_args.size() >= 1) {
      retentionDays = parsePositive("retention days", p_args.get(0));
    }
    if (p_args.size() == 2) {
      maxBackups = parsePositive("max backups", p_args.get(1));
    }
  }

  private static int parsePositive(String p_what, String p_arg) {
    if (!p_arg.matches("[0-9]+") || Integer.parseInt(p_arg) < 1) {
      throw new BadArgsException("Number of " + p_what + " must be a positive integer; was " + p_arg);
    }
    return Integer.parseInt(p_arg);
  }

  @Override
  public void run() {
    int days = retentionDays != null ? retentionDays : config.getRetentionDays();
    int max = maxBackups != null ? maxBackups : config.getMaxBackups();

    int deleted = cleanupOld(days) + enforceMaxBackups(max);
    System.out.println("Cleanup completed: " + deleted + " backup(s) deleted");
  }

  /**
   * Delete every backup created more than {@code p_retentionDays} days ago.
   *
   * @return how many were deleted
   */
  public int cleanupOld(int p_retentionDays) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(p_retentionDays));
    int deleted = 0;
    for (BackupArtifact artifact : store.list()) {
      if (artifact.getCreatedAt().isBefore(cutoff)) {
        store.delete(artifact.getKey());
        deleted++;
        log.info("Deleted old backup: {} (created {})", artifact.getKey(), artifact.getCreatedAt());
      }
    }
    return deleted;
  }

  /**
   * Keep only the {@code p_maxBackups} newest backups.  A backup that can't be deleted is logged
   * and skipped.
   *
   * @return how many were deleted
   */
  public int enforceMaxBackups(int p_maxBackups) {
    List<BackupArtifact> artifacts = store.list();
    if (artifacts.size() <= p_maxBackups) {
      return 0;
    }

    int deleted = 0;
    for (BackupArtifact artifact : artifacts.subList(p_maxBackups, artifacts.size())) {
      try {
        store.delete(artifact.getKey());
        deleted++;
        log.info("Deleted excess backup (limit {}): {}", p_maxBackups, artifact.getKey());
      } catch (BackupFailedException e) {
        log.error("Failed to delete excess backup {}: {}", artifact.getKey(), e.getMessage());
      }
    }
    return deleted;
  }

}
