package com.daveeberhart.db_util.secure_backup.fs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Test;

public class SecureFileOpsTest {
  private final Path testDir = Files.createTempDirectory("secure-fs-test");

  public SecureFileOpsTest() throws IOException {
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(testDir.toFile());
  }

  @Test
  public void testSecureDelete() throws IOException {
    Path file = testDir.resolve("dump");
    Files.write(file, new byte[200_000]);

    SecureFileOps.secureDelete(file);
    Assert.assertFalse(Files.exists(file));
  }

  @Test
  public void testSecureDeleteMissingFile() {
    SecureFileOps.secureDelete(testDir.resolve("nope"));
  }

  @Test
  public void testSecureDeleteIgnoresDirectories() {
    SecureFileOps.secureDelete(testDir);
    Assert.assertTrue(Files.isDirectory(testDir));
  }

  @Test
  public void testSecureDeleteFallsBackWhenOverwriteFails() throws IOException {
    Assume.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    Path file = testDir.resolve("readonly");
    Files.write(file, "secret".getBytes(StandardCharsets.UTF_8));
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("r--------"));
    Assume.assumeFalse("running as root; the overwrite would succeed", Files.isWritable(file));

    SecureFileOps.secureDelete(file);
    Assert.assertFalse(Files.exists(file));
  }

  @Test
  public void testMd5() throws IOException {
    Path empty = testDir.resolve("empty");
    Files.write(empty, new byte[0]);
    Assert.assertEquals("d41d8cd98f00b204e9800998ecf8427e", SecureFileOps.md5Hex(empty));

    Path abc = testDir.resolve("abc");
    Files.write(abc, "abc".getBytes(StandardCharsets.US_ASCII));
    Assert.assertEquals("900150983cd24fb0d6963f7d28e17f72", SecureFileOps.md5Hex(abc));
  }

}
