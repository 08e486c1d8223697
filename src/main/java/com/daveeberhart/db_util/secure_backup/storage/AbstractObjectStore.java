package com.daveeberhart.db_util.secure_backup.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;
import com.daveeberhart.db_util.secure_backup.fs.SecureFileOps;

/**
 * Verified-upload logic shared by all stores: compute the local tag, transfer, fetch the remote
 * tag, and delete the object again if the two disagree.
 */
public abstract class AbstractObjectStore implements RemoteObjectStore {
  private static final Logger log = LoggerFactory.getLogger(AbstractObjectStore.class);

  @Override
  public BackupArtifact upload(Path p_localPath, String p_key, boolean p_verify) {
    ensureBucket();

    String localTag = null;
    if (p_verify) {
      try {
        localTag = localIntegrityTag(p_localPath);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    transfer(p_localPath, p_key);
    log.info("Uploaded backup: {}", p_key);

    BackupArtifact stored;
    try {
      stored = getMetadata(p_key).orElse(null);
    } catch (RuntimeException e) {
      if (p_verify) {
        discardUnverified(p_key, e);
      }
      throw e;
    }
    if (p_verify) {
      String remoteTag = stored == null ? null : stored.getIntegrityTag();
      if (remoteTag == null || !remoteTag.equals(localTag)) {
        IntegrityCheckFailedException failure = new IntegrityCheckFailedException(
            "Upload verification failed for " + p_key + ": local=" + localTag + ", remote=" + remoteTag);
        discardUnverified(p_key, failure);
        throw failure;
      }
      log.info("Upload verified: {} (tag {})", p_key, localTag);
    }
    if (stored == null) {
      throw new IntegrityCheckFailedException("Object " + p_key + " is missing right after upload");
    }
    return stored;
  }

  /**
   * An object that could not be verified must not stay in the store.  Failure to delete it is
   * attached to {@code p_cause} rather than replacing it.
   */
  private void discardUnverified(String p_key, RuntimeException p_cause) {
    try {
      delete(p_key);
      log.warn("Removed unverified upload {}", p_key);
    } catch (RuntimeException e) {
      log.error("Could not remove unverified upload {}: {}", p_key, e.toString());
      p_cause.addSuppressed(e);
    }
  }

  /**
   * The value the store is expected to report as {@link BackupArtifact#getIntegrityTag()} for
   * an object with this file's content.  MD5 hex by default.
   */
  protected String localIntegrityTag(Path p_localPath) throws IOException {
    return SecureFileOps.md5Hex(p_localPath);
  }

  /**
   * Move the bytes; no verification.
   */
  protected abstract void transfer(Path p_localPath, String p_key);

  @Override
  public abstract Optional<BackupArtifact> getMetadata(String p_key);

}
