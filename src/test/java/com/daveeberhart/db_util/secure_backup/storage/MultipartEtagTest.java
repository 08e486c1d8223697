package com.daveeberhart.db_util.secure_backup.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Random;

import org.apache.commons.io.FileUtils;
import org.bouncycastle.util.encoders.Hex;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class MultipartEtagTest {
  private final Path testDir = Files.createTempDirectory("etag-test");

  public MultipartEtagTest() throws IOException {
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(testDir.toFile());
  }

  @Test
  public void testSinglePart() throws Exception {
    byte[] content = randomBytes(1000);
    Path file = write(content);

    String md5 = Hex.toHexString(MessageDigest.getInstance("MD5").digest(content));
    Assert.assertEquals(md5, MultipartEtag.compute(file, 0));
    Assert.assertEquals(md5, MultipartEtag.compute(file, 1000));
  }

  @Test
  public void testMultipart() throws Exception {
    byte[] content = randomBytes(2500);
    Path file = write(content);

    MessageDigest whole = MessageDigest.getInstance("MD5");
    whole.update(MessageDigest.getInstance("MD5").digest(Arrays.copyOfRange(content, 0, 1000)));
    whole.update(MessageDigest.getInstance("MD5").digest(Arrays.copyOfRange(content, 1000, 2000)));
    whole.update(MessageDigest.getInstance("MD5").digest(Arrays.copyOfRange(content, 2000, 2500)));

    Assert.assertEquals(Hex.toHexString(whole.digest()) + "-3", MultipartEtag.compute(file, 1000));
  }

  @Test
  public void testExactMultipleOfPartSize() throws Exception {
    Path file = write(randomBytes(3000));
    Assert.assertTrue(MultipartEtag.compute(file, 1000).endsWith("-3"));
  }

  private Path write(byte[] p_content) throws IOException {
    Path file = testDir.resolve("artifact.enc");
    Files.write(file, p_content);
    return file;
  }

  private static byte[] randomBytes(int p_len) {
    byte[] bytes = new byte[p_len];
    new Random(7).nextBytes(bytes);
    return bytes;
  }

}
