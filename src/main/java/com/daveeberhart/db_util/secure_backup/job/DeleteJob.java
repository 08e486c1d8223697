package com.daveeberhart.db_util.secure_backup.job;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.pipeline.BackupKeys;

/**
 * Delete one stored backup.  Deleting a key that isn't there is not an error.
 */
public class DeleteJob extends Job {
  private static final Logger log = LoggerFactory.getLogger(DeleteJob.class);

  protected String backupKey;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (p_args.size() != 1) {
      throw new BadArgsException("delete takes exactly one backup key");
    }
    backupKey = p_args.get(0);
    if (!BackupKeys.isValidKey(backupKey)) {
      throw new BadArgsException("Invalid backup key: " + backupKey);
    }
  }

  @Override
  public void run() {
    log.warn("Deleting backup {}", backupKey);
    store.delete(backupKey);
    System.out.println("[OK] Deleted " + backupKey);
  }

}
