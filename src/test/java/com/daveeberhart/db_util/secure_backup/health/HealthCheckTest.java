package com.daveeberhart.db_util.secure_backup.health;

import java.time.Instant;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.TransportException;
import com.daveeberhart.db_util.secure_backup.storage.InMemoryObjectStore;
import com.daveeberhart.db_util.secure_backup.tool.DatabaseTool;

public class HealthCheckTest {
  private final InMemoryObjectStore store = Mockito.spy(new InMemoryObjectStore());
  private final DatabaseTool tool = Mockito.mock(DatabaseTool.class);

  @Test
  public void testHealthy() {
    store.put("older.enc", new byte[1], Instant.parse("2025-01-01T00:00:00Z"));
    store.put("latest.enc", new byte[1], Instant.parse("2025-02-01T00:00:00Z"));
    Mockito.when(tool.isDumpToolAvailable()).thenReturn(true);
    Mockito.when(tool.isRestoreToolAvailable()).thenReturn(true);

    HealthReport report = new HealthCheck(config("0123456789abcdef0123456789abcdef"), store, tool).check();

    Assert.assertTrue(report.isHealthy());
    Assert.assertTrue(report.isEncryptionKeyConfigured());
    Assert.assertTrue(report.isStorageReachable());
    Assert.assertEquals(2, report.getBackupCount());
    Assert.assertEquals("latest.enc", report.getLatestBackupKey());
  }

  @Test
  public void testChecksAreIndependent() {
    store.setReachable(false);
    Mockito.when(tool.isDumpToolAvailable()).thenReturn(true);
    Mockito.when(tool.isRestoreToolAvailable()).thenReturn(false);

    HealthReport report = new HealthCheck(config("short"), store, tool).check();

    Assert.assertFalse(report.isHealthy());
    Assert.assertFalse(report.isEncryptionKeyConfigured());
    Assert.assertFalse(report.isStorageReachable());
    Assert.assertTrue(report.isDumpToolAvailable());
    Assert.assertFalse(report.isRestoreToolAvailable());
    Assert.assertEquals(0, report.getBackupCount());
    Assert.assertNull(report.getLatestBackupKey());
    Mockito.verify(store, Mockito.never()).list();
  }

  @Test
  public void testListingFailureIsReported() {
    Mockito.doThrow(new TransportException("Access Denied", null)).when(store).list();

    HealthReport report = new HealthCheck(config("0123456789abcdef0123456789abcdef"), store, tool).check();

    Assert.assertTrue(report.isStorageReachable());
    Assert.assertEquals(0, report.getBackupCount());
  }

  @Test
  public void testNothingConfigured() {
    HealthReport report = new HealthCheck(new BackupConfig(new Properties(), "test"), null, null).check();

    Assert.assertFalse(report.isHealthy());
    Assert.assertFalse(report.isEncryptionKeyConfigured());
    Assert.assertFalse(report.isStorageReachable());
    Assert.assertFalse(report.isDumpToolAvailable());
    Assert.assertTrue(report.toString().contains("latestBackupKey=(none)"));
  }

  private static BackupConfig config(String p_key) {
    Properties props = new Properties();
    props.setProperty(BackupConfig.ENCRYPTION_KEY, p_key);
    return new BackupConfig(props, "test");
  }

}
