package com.daveeberhart.db_util.secure_backup.notify;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no operator channel is configured: outcomes only go to the log.
 */
public class LoggingNotifier extends AbstractNotifier {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override
  protected void sendSuccess(String p_key, Path p_artifact, long p_size) {
    log.info("Backup {} created ({} bytes)", p_key, p_size);
  }

  @Override
  protected void sendFailure(String p_error, String p_trace) {
    log.error("Backup failed: {}", p_error);
  }

}
