package com.daveeberhart.db_util.secure_backup.pipeline;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.crypto.StreamCipher;
import com.daveeberhart.db_util.secure_backup.fs.ScopedTempDir;
import com.daveeberhart.db_util.secure_backup.fs.SecureFileOps;
import com.daveeberhart.db_util.secure_backup.notify.Notifier;
import com.daveeberhart.db_util.secure_backup.storage.RemoteObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;

/**
 * Creates one backup: dump, compress, encrypt, upload, notify.
 * <p>
 * Every intermediate file lives in a private scratch directory that is removed however the run
 * ends.  The raw dump and the compressed dump are each securely deleted as soon as the next
 * step has consumed them, so only ciphertext outlives its step.
 * <p>
 * Runs are not serialized here; the scheduler must not start two at once.
 */
public class DumpPipeline {
  private static final Logger log = LoggerFactory.getLogger(DumpPipeline.class);

  private final DatabaseTool databaseTool;
  private final Compression compression;
  private final StreamCipher cipher;
  private final RemoteObjectStore store;
  private final Notifier notifier;
  private final Path scratchDir;
  private final Clock clock;

  public DumpPipeline(DatabaseTool p_databaseTool, Compression p_compression, StreamCipher p_cipher,
      RemoteObjectStore p_store, Notifier p_notifier, Path p_scratchDir, Clock p_clock) {
    databaseTool = p_databaseTool;
    compression = p_compression;
    cipher = p_cipher;
    store = p_store;
    notifier = p_notifier;
    scratchDir = p_scratchDir;
    clock = p_clock;
  }

  /**
   * @param p_name backup name, or null to generate one
   * @param p_notify tell the operator channel about a successful backup (failures are always reported)
   */
  public BackupResult createBackup(String p_name, boolean p_notify) {
    String name = p_name == null ? BackupKeys.generateName(clock) : p_name;
    try (ScopedTempDir tmp = new ScopedTempDir(scratchDir, "backup-")) {
      if (!BackupKeys.isValidName(name)) {
        throw new IllegalArgumentException("Invalid backup name: " + name);
      }
      String key = BackupKeys.toKey(name);
      Path dumpFile = tmp.resolve(name + ".dump");
      Path compressedFile = tmp.resolve(name + ".dump.xz");
      Path encryptedFile = tmp.resolve(key);

      log.info("Starting backup: {}", name);
      databaseTool.dump(dumpFile, tmp.getPath());

      compression.compress(dumpFile, compressedFile);
      SecureFileOps.secureDelete(dumpFile);

      cipher.encrypt(compressedFile, encryptedFile);
      SecureFileOps.secureDelete(compressedFile);

      store.upload(encryptedFile, key, true);
      long size = Files.size(encryptedFile);
      log.info("Backup completed: {} ({} bytes, key_id={})", key, size, cipher.getKeyId());

      if (p_notify) {
        notifier.backupSucceeded(key, encryptedFile, size);
      }
      return BackupResult.success(key, size);
    } catch (Exception e) {
      log.error("Backup {} failed", name, e);
      notifier.backupFailed(e.toString(), stackTrace(e));
      return BackupResult.failure(e.toString());
    }
  }

  private static String stackTrace(Throwable p_e) {
    StringWriter sw = new StringWriter();
    try (PrintWriter pw = new PrintWriter(sw)) {
      p_e.printStackTrace(pw);
    }
    return sw.toString();
  }

}
