package com.daveeberhart.db_util.secure_backup.job;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.notify.Notifier;
import com.daveeberhart.db_util.secure_backup.notify.TelegramNotifier;
import com.daveeberhart.db_util.secure_backup.pipeline.BackupKeys;
import com.daveeberhart.db_util.secure_backup.pipeline.BackupResult;
import com.daveeberhart.db_util.secure_backup.pipeline.DumpPipeline;
import com.daveeberhart.db_util.secure_backup.tool.PostgresTool;

/**
 * Dump the database, then compress, encrypt and upload the dump.
 * <p>
 * Meant to be run from cron (or a systemd timer).  Two backups must never run at the same time.
 * The operator channel hears about every outcome.
 */
public class BackupJob extends Job {
  private static final Logger log = LoggerFactory.getLogger(BackupJob.class);

  protected String backupName;
  protected Notifier notifier;
  protected DumpPipeline pipeline;

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (p_args.size() > 1) {
      throw new BadArgsException("Too many arguments for backup: " + p_args);
    }
    if (p_args.size() == 1) {
      backupName = p_args.get(0);
      if (!BackupKeys.isValidName(backupName)) {
        throw new BadArgsException("Backup name may only contain letters, digits, '_' and '-' (at most 100); was " + backupName);
      }
    }
  }

  @Override
  public void prepare() {
    super.prepare();
    notifier = TelegramNotifier.fromConfig(config);
    pipeline = new DumpPipeline(PostgresTool.fromConfig(config), new Compression(), newCipher(),
        store, notifier, scratchDir, Clock.systemUTC());
  }

  @Override
  public void run() {
    BackupResult result = pipeline.createBackup(backupName, true);
    if (!result.isSuccess()) {
      throw new BackupFailedException("Backup failed: " + result.getError());
    }
    System.out.println("[OK] Created backup " + result.getBackupKey() + " (" + result.getSize() + " bytes)");
  }

  @Override
  public void cleanup() {
    if (notifier instanceof Closeable) {
      try {
        ((Closeable) notifier).close();
      } catch (IOException e) {
        log.warn("Could not close notifier: {}", e.toString());
      }
    }
    super.cleanup();
  }

}
