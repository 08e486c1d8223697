package com.daveeberhart.db_util.secure_backup.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.crypto.StreamCipher;
import com.daveeberhart.db_util.secure_backup.notify.LoggingNotifier;
import com.daveeberhart.db_util.secure_backup.storage.InMemoryObjectStore;
import com.daveeberhart.db_util.secure_backup.storage.RemoteObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;
import com.daveeberhart.db_util.secure_backup.tool.FakeDatabaseTool;

public class RestorePipelineTest {
  private final Path testDir = Files.createTempDirectory("restore-test");
  private final Path scratchDir = testDir.resolve("scratch");
  private final byte[] dump = DumpPipelineTest.randomBytes(3000);
  private final FakeDatabaseTool tool = new FakeDatabaseTool(dump);
  private final StreamCipher cipher = new StreamCipher(DumpPipelineTest.KEY, "test", 1000, 1024);
  private final InMemoryObjectStore store = new InMemoryObjectStore();
  private final RestorePipeline pipeline = new RestorePipeline(cipher, new Compression(), store, tool, scratchDir);

  public RestorePipelineTest() throws IOException {
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(testDir.toFile());
  }

  @Test
  public void testWrongConfirmationTouchesNothing() {
    RemoteObjectStore mockStore = Mockito.mock(RemoteObjectStore.class);
    DatabaseTool mockTool = Mockito.mock(DatabaseTool.class);
    RestorePipeline gated = new RestorePipeline(cipher, new Compression(), mockStore, mockTool, scratchDir);

    RestoreResult result = gated.restoreBackup("backup_20250301_0a1b2c3d.enc", "WRONG", true);

    Assert.assertFalse(result.isSuccess());
    Assert.assertTrue(result.getError(), result.getError().contains("RESTORE-backup_20250301_0a1b2c3d.enc"));
    Mockito.verifyNoInteractions(mockStore, mockTool);
    Assert.assertFalse(Files.exists(scratchDir));
  }

  @Test
  public void testInvalidKeyTouchesNothing() {
    RemoteObjectStore mockStore = Mockito.mock(RemoteObjectStore.class);
    DatabaseTool mockTool = Mockito.mock(DatabaseTool.class);
    RestorePipeline gated = new RestorePipeline(cipher, new Compression(), mockStore, mockTool, scratchDir);

    String key = "../../etc/passwd.enc";
    Assert.assertFalse(gated.restoreBackup(key, "RESTORE-" + key, false).isSuccess());
    Assert.assertFalse(gated.verifyBackup(key).isSuccess());
    Assert.assertFalse(gated.restoreBackup(null, null, false).isSuccess());
    Mockito.verifyNoInteractions(mockStore, mockTool);
  }

  @Test
  public void testRestore() throws IOException {
    String key = createBackup();

    RestoreResult result = pipeline.restoreBackup(key, "RESTORE-" + key, true);

    Assert.assertTrue(result.getError(), result.isSuccess());
    Assert.assertNull(result.getError());
    Assert.assertEquals(1, tool.getRestores());
    Assert.assertTrue(tool.wasLastDropExisting());
    Assert.assertArrayEquals(dump, tool.getRestoredContent());
    assertScratchEmpty();
  }

  @Test
  public void testRestoreToolFailure() throws IOException {
    String key = createBackup();
    tool.failRestore();

    RestoreResult result = pipeline.restoreBackup(key, BackupKeys.confirmationFor(key), false);

    Assert.assertFalse(result.isSuccess());
    Assert.assertTrue(result.getError(), result.getError().contains("permission denied"));
    assertScratchEmpty();
  }

  @Test
  public void testMissingBackup() throws IOException {
    RestoreResult result = pipeline.restoreBackup("nope.enc", "RESTORE-nope.enc", false);

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals(0, tool.getRestores());
    assertScratchEmpty();
  }

  @Test
  public void testTamperedBackupIsNeverRestored() throws IOException {
    String key = createBackup();
    byte[] content = store.getContent(key);
    content[content.length - 1] ^= 0x01;
    store.put(key, content, Instant.now());

    RestoreResult result = pipeline.restoreBackup(key, "RESTORE-" + key, false);

    Assert.assertFalse(result.isSuccess());
    Assert.assertTrue(result.getError(), result.getError().contains("IntegrityCheckFailedException"));
    Assert.assertEquals(0, tool.getRestores());
    assertScratchEmpty();
  }

  /**
   * Dropping whole trailing chunks leaves every remaining tag valid; decompression has to catch
   * it before anything reaches the database.
   */
  @Test
  public void testBackupCutOnChunkBoundaryIsNeverRestored() throws IOException {
    String key = createBackup();
    byte[] content = store.getContent(key);
    int twoChunks = 25 + 2 * (1024 + 16);
    Assert.assertTrue("need more than two chunks, have " + content.length, content.length > twoChunks);
    store.put(key, Arrays.copyOf(content, twoChunks), Instant.now());

    RestoreResult result = pipeline.restoreBackup(key, "RESTORE-" + key, false);

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals(0, tool.getRestores());
    assertScratchEmpty();
  }

  @Test
  public void testStructurallyBrokenBackup() throws IOException {
    store.put("short.enc", new byte[] { 1, 2, 3 }, Instant.now());

    RestoreResult result = pipeline.restoreBackup("short.enc", "RESTORE-short.enc", false);

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals("Backup file corrupted", result.getError());
    Assert.assertEquals(0, tool.getRestores());
  }

  @Test
  public void testVerify() throws IOException {
    String key = createBackup();

    Assert.assertTrue(pipeline.verifyBackup(key).isSuccess());
    Assert.assertEquals(0, tool.getRestores());
    assertScratchEmpty();

    byte[] content = store.getContent(key);
    content[40] ^= 0x01;
    store.put(key, content, Instant.now());
    Assert.assertFalse(pipeline.verifyBackup(key).isSuccess());
    Assert.assertEquals(0, tool.getRestores());
    assertScratchEmpty();
  }

  private String createBackup() {
    DumpPipeline dumper = new DumpPipeline(tool, new Compression(1), cipher, store, new LoggingNotifier(), scratchDir, Clock.systemUTC());
    BackupResult result = dumper.createBackup(null, false);
    Assert.assertTrue(result.getError(), result.isSuccess());
    return result.getBackupKey();
  }

  private void assertScratchEmpty() throws IOException {
    try (Stream<Path> files = Files.list(scratchDir)) {
      Assert.assertEquals(0, files.count());
    }
  }

}
