package com.daveeberhart.db_util.secure_backup.health;

/**
 * Snapshot of the backup system's readiness.  Each check is independent of the others.
 */
public final class HealthReport {
  private final boolean encryptionKeyConfigured;
  private final boolean storageReachable;
  private final boolean dumpToolAvailable;
  private final boolean restoreToolAvailable;
  private final int backupCount;
  private final String latestBackupKey;

  public HealthReport(boolean p_encryptionKeyConfigured, boolean p_storageReachable, boolean p_dumpToolAvailable,
      boolean p_restoreToolAvailable, int p_backupCount, String p_latestBackupKey) {
    encryptionKeyConfigured = p_encryptionKeyConfigured;
    storageReachable = p_storageReachable;
    dumpToolAvailable = p_dumpToolAvailable;
    restoreToolAvailable = p_restoreToolAvailable;
    backupCount = p_backupCount;
    latestBackupKey = p_latestBackupKey;
  }

  public boolean isEncryptionKeyConfigured() {
    return encryptionKeyConfigured;
  }

  public boolean isStorageReachable() {
    return storageReachable;
  }

  public boolean isDumpToolAvailable() {
    return dumpToolAvailable;
  }

  public boolean isRestoreToolAvailable() {
    return restoreToolAvailable;
  }

  public int getBackupCount() {
    return backupCount;
  }

  /**
   * @return key of the newest stored backup, or null if there are none (or storage is down)
   */
  public String getLatestBackupKey() {
    return latestBackupKey;
  }

  /**
   * @return true if backups can be taken and restored right now
   */
  public boolean isHealthy() {
    return encryptionKeyConfigured && storageReachable && dumpToolAvailable && restoreToolAvailable;
  }

  @Override
  public String toString() {
    return "encryptionKeyConfigured=" + encryptionKeyConfigured
        + "\nstorageReachable=" + storageReachable
        + "\ndumpToolAvailable=" + dumpToolAvailable
        + "\nrestoreToolAvailable=" + restoreToolAvailable
        + "\nbackupCount=" + backupCount
        + "\nlatestBackupKey=" + (latestBackupKey == null ? "(none)" : latestBackupKey);
  }

}
