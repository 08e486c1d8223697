package com.daveeberhart.db_util.secure_backup.pipeline;

/**
 * Outcome of a backup run.  Never persisted.
 */
public final class BackupResult {
  static final int MAX_ERROR_LENGTH = 500;

  private final boolean success;
  private final String backupKey;
  private final long size;
  private final String error;

  private BackupResult(boolean p_success, String p_backupKey, long p_size, String p_error) {
    success = p_success;
    backupKey = p_backupKey;
    size = p_size;
    error = p_error;
  }

  public static BackupResult success(String p_backupKey, long p_size) {
    return new BackupResult(true, p_backupKey, p_size, null);
  }

  public static BackupResult failure(String p_error) {
    return new BackupResult(false, null, 0, truncate(p_error));
  }

  static String truncate(String p_error) {
    if (p_error == null) {
      return "Unknown error";
    }
    return p_error.length() > MAX_ERROR_LENGTH ? p_error.substring(0, MAX_ERROR_LENGTH) : p_error;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getBackupKey() {
    return backupKey;
  }

  public long getSize() {
    return size;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return success ? "BackupResult[ok " + backupKey + ", " + size + " bytes]" : "BackupResult[failed: " + error + "]";
  }

}
