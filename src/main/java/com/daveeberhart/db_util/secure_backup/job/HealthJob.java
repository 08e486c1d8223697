package com.daveeberhart.db_util.secure_backup.job;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.health.HealthCheck;
import com.daveeberhart.db_util.secure_backup.health.HealthReport;
import com.daveeberhart.db_util.secure_backup.storage.S3ObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;
import com.daveeberhart.db_util.secure_backup.tool.PostgresTool;

/**
 * Print the readiness report.  Fails (exit 66) unless every check passes, so it can be wired
 * straight into a monitoring probe.
 * <p>
 * Unlike the other jobs, incomplete settings are reported rather than fatal.
 */
public class HealthJob extends Job {
  private static final Logger log = LoggerFactory.getLogger(HealthJob.class);

  protected HealthCheck healthCheck;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (!p_args.isEmpty()) {
      throw new BadArgsException("health takes no arguments");
    }
  }

  @Override
  public void prepare() {
    config = loadConfig();

    try {
      store = S3ObjectStore.fromConfig(config);
    } catch (BackupFailedException e) {
      log.warn("Object store not configured: {}", e.getMessage());
    }

    DatabaseTool tool = null;
    try {
      tool = PostgresTool.fromConfig(config);
    } catch (BackupFailedException e) {
      log.warn("Database not configured: {}", e.getMessage());
    }

    healthCheck = new HealthCheck(config, store, tool);
  }

  @Override
  public void run() {
    HealthReport report = healthCheck.check();
    System.out.println(report);
    if (!report.isHealthy()) {
      throw new BackupFailedException("Backup system is degraded");
    }
    System.out.println("[OK] healthy");
  }

}
