package com.daveeberhart.db_util.secure_backup.error;

/**
 * Root of every failure raised by the backup and restore pipelines.
 */
public class BackupFailedException extends RuntimeException {

  public BackupFailedException(String p_mesg) {
    super(p_mesg);
  }

  public BackupFailedException(String p_mesg, Throwable e) {
    super(p_mesg, e);
  }

  /**
   * Master key absent or too short, a required setting missing, or an external tool not installed.
   */
  public static class ConfigurationException extends BackupFailedException {
    public ConfigurationException(String p_mesg) {
      super(p_mesg);
    }
  }

  /**
   * An external database tool exited with a non-zero status.
   */
  public static class ToolExecutionException extends BackupFailedException {
    private final int exitCode;
    private final String stderr;

    public ToolExecutionException(String p_tool, int p_exitCode, String p_stderr) {
      super(p_tool + " failed (exit code " + p_exitCode + "): " + p_stderr);
      exitCode = p_exitCode;
      stderr = p_stderr;
    }

    public int getExitCode() {
      return exitCode;
    }

    public String getStderr() {
      return stderr;
    }
  }

  /**
   * Authentication tag mismatch, checksum mismatch after upload, or an unparseable header.
   * Never retried.
   */
  public static class IntegrityCheckFailedException extends BackupFailedException {
    public IntegrityCheckFailedException(String p_mesg) {
      super(p_mesg);
    }

    public IntegrityCheckFailedException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

  /**
   * The object store could not be reached, or rejected a request.
   */
  public static class TransportException extends BackupFailedException {
    public TransportException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

}
