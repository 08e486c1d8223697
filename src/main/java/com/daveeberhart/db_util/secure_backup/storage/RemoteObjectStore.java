package com.daveeberhart.db_util.secure_backup.storage;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.TransportException;

/**
 * Durable storage for encrypted backups.
 * <p>
 * Implementations are explicitly constructed and owned by the caller, who must {@link #close()}
 * them.  Transport failures surface as {@link TransportException}.
 */
public interface RemoteObjectStore extends Closeable {

  /**
   * Create the bucket if it does not exist yet.  Idempotent.
   */
  void ensureBucket();

  /**
   * Upload a local file.
   * <p>
   * With {@code p_verify}, the store's integrity tag for the new object is compared with one
   * computed locally before the transfer.  On mismatch the remote object is deleted and
   * {@link IntegrityCheckFailedException} is thrown, so an artifact is either verified and
   * listable or absent.
   *
   * @return the stored artifact
   */
  BackupArtifact upload(Path p_localPath, String p_key, boolean p_verify);

  void download(String p_key, Path p_localPath);

  /**
   * @return every artifact, newest first
   */
  List<BackupArtifact> list();

  /**
   * Delete an object.  Deleting a key that does not exist is not an error.
   */
  void delete(String p_key);

  Optional<BackupArtifact> getMetadata(String p_key);

  /**
   * @return whether the store answers at all; never throws
   */
  boolean isReachable();

  @Override
  void close();

}
