package com.daveeberhart.db_util.secure_backup.job;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.crypto.StreamCipher;
import com.daveeberhart.db_util.secure_backup.storage.RemoteObjectStore;
import com.daveeberhart.db_util.secure_backup.storage.S3ObjectStore;

/**
 * Base class for all jobs.
 * <p>
 * The lifecycle of a job:
 * <ol>
 * <li>{@link #setScratchDir(Path)}</li>
 * <li>{@link #setRemainingArgs(List)}</li>
 * <li>{@link #prepare()}</li>
 * <li>{@link #run()}</li>
 * <li>{@link #cleanup()}</li>
 * </ol>
 * <p>
 * Note: You should call {@link #cleanup()} if you've even attempted a call to
 * {@link #prepare()}.
 */
public abstract class Job {
  private static final Logger log = LoggerFactory.getLogger(Job.class);

  protected BackupConfig config;
  protected RemoteObjectStore store;
  protected Path scratchDir;

  /**
   * Load the settings and connect to the object store.
   */
  public void prepare() {
    config = loadConfig();
    store = S3ObjectStore.fromConfig(config);
  }

  protected BackupConfig loadConfig() {
    BackupConfig conf = BackupConfig.load();
    if (!conf.hasFileSettings()) {
      log.warn("Config file not found (or empty) at {}", conf.getSource());
    }
    return conf;
  }

  protected StreamCipher newCipher() {
    return new StreamCipher(config.getEncryptionKey(), config.getEncryptionKeyId());
  }

  /**
   * @return Directory for temp files (dumps, downloads); never holds anything after the job ends
   */
  public Path getScratchDir() {
    return scratchDir;
  }

  public void setScratchDir(Path p_scratchDir) {
    scratchDir = p_scratchDir;
  }

  /**
   * Set remaining job-specific commandline arguments
   * @param p_args remaining commandline arguments
   */
  public abstract void setRemainingArgs(List<String> p_args);

  /**
   * Run the job.
   */
  public abstract void run();

  /**
   * Shutdown the job and release all resources.
   */
  public void cleanup() {
    if (store != null) {
      store.close();
    }
  }

}
