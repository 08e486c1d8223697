package com.daveeberhart.db_util.secure_backup.fs;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for sensitive temporary files: overwrite-then-delete, and content checksums.
 */
public final class SecureFileOps {
  private static final Logger log = LoggerFactory.getLogger(SecureFileOps.class);

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final SecureRandom random = new SecureRandom();

  private SecureFileOps() {
  }

  /**
   * Overwrite a file with random bytes, then unlink it.  Raw dumps may contain personal data and
   * must not stay recoverable.
   * <p>
   * If the overwrite fails we fall back to a plain delete and log a warning; losing the backup
   * would be worse than the remanence risk.  A missing file is ignored.
   */
  public static void secureDelete(Path p_file) {
    if (!Files.isRegularFile(p_file)) {
      return;
    }

    try {
      overwrite(p_file);
      Files.delete(p_file);
    } catch (IOException | RuntimeException e) {
      log.warn("Secure delete of {} failed, using regular delete: {}", p_file, e.toString());
      try {
        Files.deleteIfExists(p_file);
      } catch (IOException e2) {
        throw new UncheckedIOException("Could not delete " + p_file, e2);
      }
    }
  }

  private static void overwrite(Path p_file) throws IOException {
    long remaining = Files.size(p_file);
    byte[] buff = new byte[BUFFER_SIZE];
    try (OutputStream out = Files.newOutputStream(p_file, StandardOpenOption.WRITE, StandardOpenOption.DSYNC)) {
      while (remaining > 0) {
        int len = (int) Math.min(buff.length, remaining);
        random.nextBytes(buff);
        out.write(buff, 0, len);
        remaining -= len;
      }
    }
  }

  /**
   * @return MD5 of the file's content, lower-case hex
   */
  public static String md5Hex(Path p_file) throws IOException {
    return Hex.toHexString(digest(p_file, "MD5"));
  }

  public static byte[] digest(Path p_file, String p_algorithm) throws IOException {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance(p_algorithm);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(p_algorithm + " is not available", e);
    }
    try (InputStream fin = Files.newInputStream(p_file);
         DigestInputStream digfin = new DigestInputStream(fin, md)) {
      byte[] buff = new byte[BUFFER_SIZE];
      while (digfin.read(buff, 0, buff.length) >= 0) {
        // Loop.
      }
    }
    return md.digest();
  }

}
