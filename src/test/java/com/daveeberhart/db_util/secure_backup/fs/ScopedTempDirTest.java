package com.daveeberhart.db_util.secure_backup.fs;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class ScopedTempDirTest {
  private final Path testDir = Files.createTempDirectory("scoped-test");

  public ScopedTempDirTest() throws IOException {
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(testDir.toFile());
  }

  @Test
  public void testRemovedOnClose() throws IOException {
    Path dir;
    try (ScopedTempDir tmp = new ScopedTempDir(testDir, "backup-")) {
      dir = tmp.getPath();
      Assert.assertTrue(Files.isDirectory(dir));
      Assert.assertTrue(dir.getFileName().toString().startsWith("backup-"));
      if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
        Assert.assertEquals("rwx------", PosixFilePermissions.toString(Files.getPosixFilePermissions(dir)));
      }

      Files.write(tmp.resolve("a.dump"), new byte[1000]);
      Files.createDirectories(tmp.resolve("sub"));
      Files.write(tmp.resolve("sub").resolve("b"), new byte[10]);
    }
    Assert.assertFalse(Files.exists(dir));
  }

  @Test
  public void testRemovedOnException() throws IOException {
    Path dir = null;
    try (ScopedTempDir tmp = new ScopedTempDir(testDir, "restore-")) {
      dir = tmp.getPath();
      Files.write(tmp.resolve("x"), new byte[10]);
      throw new IllegalStateException("boom");
    } catch (IllegalStateException e) {
      Assert.assertEquals("boom", e.getMessage());
    }
    Assert.assertFalse(Files.exists(dir));
  }

  @Test
  public void testCreatesMissingParent() throws IOException {
    try (ScopedTempDir tmp = new ScopedTempDir(testDir.resolve("not/yet"), "x-")) {
      Assert.assertTrue(Files.isDirectory(tmp.getPath()));
    }
  }

}
