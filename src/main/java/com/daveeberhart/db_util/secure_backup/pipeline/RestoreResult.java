package com.daveeberhart.db_util.secure_backup.pipeline;

/**
 * Outcome of a restore or verify run, for callers that branch on it rather than catch.
 */
public final class RestoreResult {
  private final boolean success;
  private final String error;

  private RestoreResult(boolean p_success, String p_error) {
    success = p_success;
    error = p_error;
  }

  public static RestoreResult success() {
    return new RestoreResult(true, null);
  }

  public static RestoreResult failure(String p_error) {
    return new RestoreResult(false, BackupResult.truncate(p_error));
  }

  public boolean isSuccess() {
    return success;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return success ? "RestoreResult[ok]" : "RestoreResult[failed: " + error + "]";
  }

}
