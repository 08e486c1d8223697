package com.daveeberhart.db_util.secure_backup.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import com.daveeberhart.db_util.secure_backup.compress.Compression;
import com.daveeberhart.db_util.secure_backup.crypto.StreamCipher;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.notify.LoggingNotifier;
import com.daveeberhart.db_util.secure_backup.pipeline.DumpPipeline;
import com.daveeberhart.db_util.secure_backup.pipeline.RestorePipeline;
import com.daveeberhart.db_util.secure_backup.storage.InMemoryObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.FakeDatabaseTool;

/**
 * Tests for the restore, verify, delete and list jobs.
 */
public class RestoreJobTest {
  private static final String KEY = "nightly.enc";

  private final Path testDir = Files.createTempDirectory("restore-job-test");
  private final InMemoryObjectStore store = new InMemoryObjectStore();
  private final byte[] dump = "PGDMP restore me".getBytes();
  private final FakeDatabaseTool tool = new FakeDatabaseTool(dump);
  private final StreamCipher cipher = new StreamCipher("0123456789abcdef0123456789abcdef", "test", 1000, 1024);

  public RestoreJobTest() throws IOException {
    new DumpPipeline(tool, new Compression(1), cipher, store, new LoggingNotifier(), testDir, Clock.systemUTC())
        .createBackup("nightly", false);
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(testDir.toFile());
  }

  @Test(expected=BadArgsException.class)
  public void testMissingConfirmation() {
    new TestableRestoreJob().setRemainingArgs(Arrays.asList(KEY));
  }

  @Test(expected=BadArgsException.class)
  public void testUnknownFlag() {
    new TestableRestoreJob().setRemainingArgs(Arrays.asList(KEY, "RESTORE-" + KEY, "--force"));
  }

  @Test
  public void testArgs() {
    RestoreJob job = new TestableRestoreJob();
    job.setRemainingArgs(Arrays.asList(KEY, "RESTORE-" + KEY, "--drop-existing"));
    Assert.assertEquals(KEY, job.backupKey);
    Assert.assertEquals("RESTORE-" + KEY, job.confirmation);
    Assert.assertTrue(job.dropExisting);
  }

  @Test
  public void testRestore() {
    RestoreJob job = new TestableRestoreJob();
    job.setScratchDir(testDir);
    job.setRemainingArgs(Arrays.asList(KEY, "RESTORE-" + KEY));
    job.prepare();
    job.run();

    Assert.assertArrayEquals(dump, tool.getRestoredContent());
    Assert.assertFalse(tool.wasLastDropExisting());
  }

  @Test
  public void testRestoreWrongConfirmation() {
    RestoreJob job = new TestableRestoreJob();
    job.setScratchDir(testDir);
    job.setRemainingArgs(Arrays.asList(KEY, "WRONG"));
    job.prepare();
    try {
      job.run();
      Assert.fail("Restore ran without a valid confirmation");
    } catch (BackupFailedException e) {
      Assert.assertTrue(e.getMessage(), e.getMessage().contains("Invalid confirmation"));
    }
    Assert.assertEquals(0, tool.getRestores());
  }

  @Test
  public void testVerify() {
    VerifyJob job = new VerifyJob() {
      @Override
      public void prepare() {
        store = RestoreJobTest.this.store;
        pipeline = new RestorePipeline(cipher, new Compression(), store, null, scratchDir);
      }
    };
    job.setScratchDir(testDir);
    job.setRemainingArgs(Arrays.asList(KEY));
    job.prepare();
    job.run();

    byte[] content = store.getContent(KEY);
    content[30] ^= 0x01;
    store.put(KEY, content, Instant.now());
    try {
      job.run();
      Assert.fail("Tampered backup verified");
    } catch (IntegrityCheckFailedException e) {
      // Expected.
    }
  }

  @Test
  public void testDelete() {
    DeleteJob job = new DeleteJob() {
      @Override
      public void prepare() {
        store = RestoreJobTest.this.store;
      }
    };
    job.setRemainingArgs(Arrays.asList(KEY));
    job.prepare();
    job.run();
    job.run();

    Assert.assertFalse(store.contains(KEY));
  }

  @Test(expected=BadArgsException.class)
  public void testDeleteUnsafeKey() {
    new DeleteJob().setRemainingArgs(Arrays.asList("../../x.enc"));
  }

  @Test
  public void testList() {
    ListJob job = new ListJob() {
      @Override
      public void prepare() {
        store = RestoreJobTest.this.store;
      }
    };
    job.setRemainingArgs(Arrays.asList());
    job.prepare();
    job.run();
    job.cleanup();

    Assert.assertTrue(store.isClosed());
  }

  private final class TestableRestoreJob extends RestoreJob {
    @Override
    public void prepare() {
      store = RestoreJobTest.this.store;
      pipeline = new RestorePipeline(cipher, new Compression(), store, tool, scratchDir);
    }
  }

}
