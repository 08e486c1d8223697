package com.daveeberhart.db_util.secure_backup.pipeline;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.crypto.StreamCipher;
import com.daveeberhart.db_util.secure_backup.fs.ScopedTempDir;
import com.daveeberhart.db_util.secure_backup.fs.SecureFileOps;
import com.daveeberhart.db_util.secure_backup.storage.RemoteObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;

/**
 * Restores a backup (download, verify, decrypt, decompress, restore), or checks one without
 * touching the database.
 * <p>
 * Failures come back as {@link RestoreResult}s, never as exceptions.
 * <p>
 * Once the restore tool has started, the restore cannot be safely aborted.
 */
public class RestorePipeline {
  private static final Logger log = LoggerFactory.getLogger(RestorePipeline.class);

  private static final String ENCRYPTED_FILE = "backup.enc";
  private static final String COMPRESSED_FILE = "backup.dump.xz";
  private static final String DUMP_FILE = "backup.dump";

  private final StreamCipher cipher;
  private final Compression compression;
  private final RemoteObjectStore store;
  private final DatabaseTool databaseTool;
  private final Path scratchDir;

  public RestorePipeline(StreamCipher p_cipher, Compression p_compression, RemoteObjectStore p_store,
      DatabaseTool p_databaseTool, Path p_scratchDir) {
    cipher = p_cipher;
    compression = p_compression;
    store = p_store;
    databaseTool = p_databaseTool;
    scratchDir = p_scratchDir;
  }

  /**
   * Restore {@code p_key} over the live database.
   *
   * @param p_confirmation must be exactly {@code "RESTORE-" + p_key}; anything else is rejected
   *          before any I/O happens
   * @param p_dropExisting drop conflicting objects before restoring
   */
  public RestoreResult restoreBackup(String p_key, String p_confirmation, boolean p_dropExisting) {
    if (!BackupKeys.isValidKey(p_key)) {
      return RestoreResult.failure("Invalid backup key: " + p_key);
    }
    String expected = BackupKeys.confirmationFor(p_key);
    if (!expected.equals(p_confirmation)) {
      log.warn("Restore of {} rejected: wrong confirmation", p_key);
      return RestoreResult.failure("Invalid confirmation. Expected: '" + expected + "'");
    }

    log.warn("Restore initiated: {} (dropExisting={})", p_key, p_dropExisting);
    try (ScopedTempDir tmp = new ScopedTempDir(scratchDir, "restore-")) {
      Path encryptedFile = tmp.resolve(ENCRYPTED_FILE);
      Path compressedFile = tmp.resolve(COMPRESSED_FILE);
      Path dumpFile = tmp.resolve(DUMP_FILE);

      log.info("Downloading backup: {}", p_key);
      store.download(p_key, encryptedFile);
      if (!cipher.verify(encryptedFile)) {
        return RestoreResult.failure("Backup file corrupted");
      }

      log.info("Decrypting backup...");
      cipher.decrypt(encryptedFile, compressedFile);
      Files.delete(encryptedFile);

      log.info("Decompressing backup...");
      compression.decompress(compressedFile, dumpFile);
      SecureFileOps.secureDelete(compressedFile);

      log.info("Restoring database...");
      databaseTool.restore(dumpFile, p_dropExisting, tmp.getPath());
      SecureFileOps.secureDelete(dumpFile);

      log.info("Restore completed: {}", p_key);
      return RestoreResult.success();
    } catch (Exception e) {
      log.error("Restore of {} failed", p_key, e);
      return RestoreResult.failure(e.toString());
    }
  }

  /**
   * Non-destructive check: download, check the header, decrypt the whole archive and make sure
   * the decompressor accepts it.  Never runs the restore tool.
   */
  public RestoreResult verifyBackup(String p_key) {
    if (!BackupKeys.isValidKey(p_key)) {
      return RestoreResult.failure("Invalid backup key: " + p_key);
    }

    try (ScopedTempDir tmp = new ScopedTempDir(scratchDir, "verify-")) {
      Path encryptedFile = tmp.resolve(ENCRYPTED_FILE);
      Path compressedFile = tmp.resolve(COMPRESSED_FILE);

      store.download(p_key, encryptedFile);
      if (!cipher.verify(encryptedFile)) {
        return RestoreResult.failure("Backup file corrupted");
      }

      cipher.decrypt(encryptedFile, compressedFile);
      try (InputStream in = compression.openDecompressing(Files.newInputStream(compressedFile))) {
        in.read();
      }

      log.info("Backup {} verified", p_key);
      return RestoreResult.success();
    } catch (Exception e) {
      log.error("Verification of {} failed: {}", p_key, e.toString());
      return RestoreResult.failure(e.toString());
    }
  }

}
