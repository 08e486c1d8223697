package com.daveeberhart.db_util.secure_backup.fs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * A short-lived, owner-read/write-only file holding database credentials for a subprocess.
 * Securely deleted on close.
 * <p>
 * Credentials never go on a command line (visible in process listings) or into a long-lived
 * environment variable; the child is only told where this file is.
 */
public class CredentialsFile implements AutoCloseable {
  private final Path file;

  public CredentialsFile(Path p_file, String p_content) throws IOException {
    file = p_file;
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      Files.createFile(file, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
    } else {
      Files.createFile(file);
      file.toFile().setReadable(false, false);
      file.toFile().setReadable(true, true);
      file.toFile().setWritable(false, false);
      file.toFile().setWritable(true, true);
    }
    Files.write(file, p_content.getBytes(StandardCharsets.UTF_8), StandardOpenOption.TRUNCATE_EXISTING);
  }

  /**
   * Create a PostgreSQL password file ({@code host:port:db:user:password}).
   */
  public static CredentialsFile pgpass(Path p_file, String p_host, int p_port, String p_db, String p_user, String p_password) throws IOException {
    String line = escape(p_host) + ":" + p_port + ":" + escape(p_db) + ":" + escape(p_user) + ":" + escape(p_password) + "\n";
    return new CredentialsFile(p_file, line);
  }

  private static String escape(String p_field) {
    return p_field.replace("\\", "\\\\").replace(":", "\\:");
  }

  public Path getPath() {
    return file;
  }

  @Override
  public void close() {
    SecureFileOps.secureDelete(file);
  }

}
