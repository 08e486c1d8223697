package com.daveeberhart.db_util.secure_backup.fs;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A private (0700) working directory that is destroyed when closed.  Any regular files still
 * inside are securely deleted first.
 * <p>
 * Use with try-with-resources, so the directory goes away on every exit path.
 */
public class ScopedTempDir implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScopedTempDir.class);

  private final Path dir;

  public ScopedTempDir(Path p_parent, String p_prefix) throws IOException {
    Files.createDirectories(p_parent);
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      dir = Files.createTempDirectory(p_parent, p_prefix, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
    } else {
      dir = Files.createTempDirectory(p_parent, p_prefix);
    }
  }

  public Path getPath() {
    return dir;
  }

  public Path resolve(String p_name) {
    return dir.resolve(p_name);
  }

  @Override
  public void close() {
    if (!Files.exists(dir)) {
      return;
    }
    try {
      List<Path> leftovers;
      try (Stream<Path> walk = Files.walk(dir)) {
        leftovers = walk.filter(Files::isRegularFile).collect(Collectors.toList());
      }
      leftovers.forEach(SecureFileOps::secureDelete);
      FileUtils.deleteDirectory(dir.toFile());
    } catch (IOException e) {
      log.error("Could not remove temporary directory {}", dir, e);
    }
  }

}
