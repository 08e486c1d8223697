package com.daveeberhart.db_util.secure_backup.health;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.storage.BackupArtifact;
import com.daveeberhart.db_util.secure_backup.storage.RemoteObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;

/**
 * Runs the readiness checks.  A failing check never stops the others; it just reports false.
 */
public class HealthCheck {
  private static final Logger log = LoggerFactory.getLogger(HealthCheck.class);

  private final BackupConfig config;
  private final RemoteObjectStore store;
  private final DatabaseTool databaseTool;

  /**
   * @param p_store may be null if the store could not even be configured
   * @param p_databaseTool may be null if the database settings are incomplete
   */
  public HealthCheck(BackupConfig p_config, RemoteObjectStore p_store, DatabaseTool p_databaseTool) {
    config = p_config;
    store = p_store;
    databaseTool = p_databaseTool;
  }

  public HealthReport check() {
    boolean keyConfigured = isEncryptionKeyConfigured();
    boolean reachable = store != null && store.isReachable();

    int count = 0;
    String latest = null;
    if (reachable) {
      try {
        List<BackupArtifact> artifacts = store.list();
        count = artifacts.size();
        latest = artifacts.isEmpty() ? null : artifacts.get(0).getKey();
      } catch (BackupFailedException e) {
        log.warn("Could not list backups: {}", e.getMessage());
      }
    }

    boolean dumpTool = databaseTool != null && databaseTool.isDumpToolAvailable();
    boolean restoreTool = databaseTool != null && databaseTool.isRestoreToolAvailable();

    return new HealthReport(keyConfigured, reachable, dumpTool, restoreTool, count, latest);
  }

  private boolean isEncryptionKeyConfigured() {
    try {
      config.getEncryptionKey();
      return true;
    } catch (BackupFailedException e) {
      log.warn(e.getMessage());
      return false;
    }
  }

}
