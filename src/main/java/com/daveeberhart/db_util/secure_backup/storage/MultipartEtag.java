package com.daveeberhart.db_util.secure_backup.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.apache.commons.io.IOUtils;
import org.bouncycastle.util.encoders.Hex;

import com.daveeberhart.db_util.secure_backup.fs.SecureFileOps;

/**
 * Compute locally the ETag S3 reports for an object.
 * <p>
 * A single-part upload's ETag is the MD5 of the content.  A multipart upload's ETag is the MD5
 * of the concatenated binary part MD5s, followed by {@code -<part count>}.
 */
public final class MultipartEtag {

  private MultipartEtag() {
  }

  /**
   * @param p_partSize the part size the upload used, or {@code <= 0} for a single-part upload
   */
  public static String compute(Path p_file, long p_partSize) throws IOException {
    long size = Files.size(p_file);
    if (p_partSize <= 0 || size <= p_partSize) {
      return SecureFileOps.md5Hex(p_file);
    }

    MessageDigest whole = md5();
    int parts = 0;
    byte[] buff = new byte[64 * 1024];
    try (InputStream in = Files.newInputStream(p_file)) {
      long remaining = size;
      while (remaining > 0) {
        MessageDigest part = md5();
        long partRemaining = Math.min(p_partSize, remaining);
        while (partRemaining > 0) {
          int len = IOUtils.read(in, buff, 0, (int) Math.min(buff.length, partRemaining));
          if (len == 0) {
            throw new IOException(p_file + " shrank while computing its ETag");
          }
          part.update(buff, 0, len);
          partRemaining -= len;
          remaining -= len;
        }
        whole.update(part.digest());
        parts++;
      }
    }
    return Hex.toHexString(whole.digest()) + "-" + parts;
  }

  private static MessageDigest md5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

}
