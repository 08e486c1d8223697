package com.daveeberhart.db_util.secure_backup.job;

import java.util.List;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.pipeline.RestorePipeline;
import com.daveeberhart.db_util.secure_backup.pipeline.RestoreResult;
import com.daveeberhart.db_util.secure_backup.tool.PostgresTool;

/**
 * Restore a backup over the live database.
 * <p>
 * Destructive, so the caller has to type the confirmation phrase {@code RESTORE-<key>}.
 */
public class RestoreJob extends Job {
  static final String DROP_EXISTING = "--drop-existing";

  protected String backupKey;
  protected String confirmation;
  protected boolean dropExisting;
  protected RestorePipeline pipeline;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (p_args.size() < 2) {
      throw new BadArgsException("Missing required backup key and/or confirmation");
    }
    if (p_args.size() > 3 || (p_args.size() == 3 && !DROP_EXISTING.equals(p_args.get(2)))) {
      throw new BadArgsException("Unexpected arguments for restore: " + p_args.subList(2, p_args.size()));
    }

    backupKey = p_args.get(0);
    confirmation = p_args.get(1);
    dropExisting = p_args.size() == 3;
  }

  @Override
  public void prepare() {
    super.prepare();
    pipeline = new RestorePipeline(newCipher(), new Compression(), store, PostgresTool.fromConfig(config), scratchDir);
  }

  @Override
  public void run() {
    System.out.println("Restoring " + backupKey + (dropExisting ? " (dropping existing objects)" : ""));
    RestoreResult result = pipeline.restoreBackup(backupKey, confirmation, dropExisting);
    if (!result.isSuccess()) {
      throw new BackupFailedException("Restore failed: " + result.getError());
    }
    System.out.println("[OK] Restored " + backupKey);
  }

}
