package com.daveeberhart.db_util.secure_backup.tool;

import java.nio.file.Path;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ConfigurationException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ToolExecutionException;

/**
 * The external dump and restore tools, run as black-box subprocesses.
 * <p>
 * Calls block until the subprocess exits.  A restore that has started cannot be safely aborted.
 */
public interface DatabaseTool {

  /**
   * Dump the database to {@code p_out}.
   *
   * @param p_workDir private directory for short-lived files (credentials)
   * @throws ToolExecutionException on a non-zero exit
   * @throws ConfigurationException if the tool is not installed
   */
  void dump(Path p_out, Path p_workDir);

  /**
   * Restore {@code p_dump} into the database.
   *
   * @param p_dropExisting drop conflicting objects first (destructive)
   * @param p_workDir private directory for short-lived files (credentials)
   * @throws ToolExecutionException on a failure other than "already exists" warnings
   */
  void restore(Path p_dump, boolean p_dropExisting, Path p_workDir);

  boolean isDumpToolAvailable();

  boolean isRestoreToolAvailable();

}
