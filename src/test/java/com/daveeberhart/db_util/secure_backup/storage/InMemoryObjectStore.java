package com.daveeberhart.db_util.secure_backup.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.bouncycastle.util.encoders.Hex;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.TransportException;

/**
 * A {@link RemoteObjectStore} in memory, for tests.  Can be told to damage the next upload.
 */
public class InMemoryObjectStore extends AbstractObjectStore {
  private final Map<String, byte[]> objects = new HashMap<>();
  private final Map<String, Instant> createdAt = new HashMap<>();

  private Instant now = Instant.now();
  private boolean corruptNextUpload;
  private boolean reachable = true;
  private boolean bucketEnsured;
  private boolean closed;
  private int downloads;

  public void setNow(Instant p_now) {
    now = p_now;
  }

  public void corruptNextUpload() {
    corruptNextUpload = true;
  }

  public void setReachable(boolean p_reachable) {
    reachable = p_reachable;
  }

  /**
   * Seed an object directly, bypassing upload.
   */
  public void put(String p_key, byte[] p_content, Instant p_createdAt) {
    objects.put(p_key, p_content.clone());
    createdAt.put(p_key, p_createdAt);
  }

  public byte[] getContent(String p_key) {
    return objects.get(p_key);
  }

  public boolean contains(String p_key) {
    return objects.containsKey(p_key);
  }

  public boolean isBucketEnsured() {
    return bucketEnsured;
  }

  public boolean isClosed() {
    return closed;
  }

  public int getDownloads() {
    return downloads;
  }

  @Override
  public void ensureBucket() {
    bucketEnsured = true;
  }

  @Override
  protected void transfer(Path p_localPath, String p_key) {
    try {
      byte[] content = Files.readAllBytes(p_localPath);
      if (corruptNextUpload) {
        corruptNextUpload = false;
        if (content.length == 0) {
          content = new byte[1];
        } else {
          content[content.length / 2] ^= 0x01;
        }
      }
      put(p_key, content, now);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void download(String p_key, Path p_localPath) {
    byte[] content = objects.get(p_key);
    if (content == null) {
      throw new TransportException("NoSuchKey: " + p_key, null);
    }
    downloads++;
    try {
      Files.write(p_localPath, content);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public List<BackupArtifact> list() {
    List<BackupArtifact> artifacts = new ArrayList<>();
    for (String key : objects.keySet()) {
      artifacts.add(toArtifact(key));
    }
    artifacts.sort(Comparator.comparing(BackupArtifact::getCreatedAt).reversed());
    return artifacts;
  }

  @Override
  public void delete(String p_key) {
    objects.remove(p_key);
    createdAt.remove(p_key);
  }

  @Override
  public Optional<BackupArtifact> getMetadata(String p_key) {
    return objects.containsKey(p_key) ? Optional.of(toArtifact(p_key)) : Optional.empty();
  }

  private BackupArtifact toArtifact(String p_key) {
    byte[] content = objects.get(p_key);
    return new BackupArtifact(p_key, content.length, createdAt.get(p_key), md5Hex(content));
  }

  private static String md5Hex(byte[] p_content) {
    try {
      return Hex.toHexString(MessageDigest.getInstance("MD5").digest(p_content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  @Override
  public boolean isReachable() {
    return reachable;
  }

  @Override
  public void close() {
    closed = true;
  }

}
