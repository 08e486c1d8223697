package com.daveeberhart.db_util.secure_backup.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * One stored, encrypted backup object.  Identity is the remote key.
 */
public final class BackupArtifact {
  public static final String SUFFIX = ".enc";

  private final String key;
  private final long size;
  private final Instant createdAt;
  private final String integrityTag;

  public BackupArtifact(String p_key, long p_size, Instant p_createdAt, String p_integrityTag) {
    key = Objects.requireNonNull(p_key, "key");
    size = p_size;
    createdAt = Objects.requireNonNull(p_createdAt, "createdAt");
    integrityTag = p_integrityTag;
  }

  public String getKey() {
    return key;
  }

  /**
   * @return the key without its {@value #SUFFIX} suffix
   */
  public String getName() {
    return key.endsWith(SUFFIX) ? key.substring(0, key.length() - SUFFIX.length()) : key;
  }

  public long getSize() {
    return size;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getIntegrityTag() {
    return integrityTag;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BackupArtifact && key.equals(((BackupArtifact) o).key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + " (" + size + " bytes, " + createdAt + ")";
  }

}
