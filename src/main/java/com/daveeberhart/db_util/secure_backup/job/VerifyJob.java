package com.daveeberhart.db_util.secure_backup.job;

import java.util.List;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.pipeline.RestorePipeline;
import com.daveeberhart.db_util.secure_backup.pipeline.RestoreResult;

/**
 * Download a backup and prove it decrypts and decompresses, without touching the database.
 */
public class VerifyJob extends Job {
  protected String backupKey;
  protected RestorePipeline pipeline;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (p_args.size() != 1) {
      throw new BadArgsException("verify takes exactly one backup key");
    }
    backupKey = p_args.get(0);
  }

  @Override
  public void prepare() {
    super.prepare();
    pipeline = new RestorePipeline(newCipher(), new Compression(), store, null, scratchDir);
  }

  @Override
  public void run() {
    RestoreResult result = pipeline.verifyBackup(backupKey);
    if (!result.isSuccess()) {
      throw new IntegrityCheckFailedException("Verification of " + backupKey + " failed: " + result.getError());
    }
    System.out.println("[OK] " + backupKey + " decrypts and decompresses cleanly");
  }

}
