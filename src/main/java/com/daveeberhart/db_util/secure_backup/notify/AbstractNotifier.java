package com.daveeberhart.db_util.secure_backup.notify;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class that keeps the {@link Notifier} contract: whatever the delivery code throws is
 * logged here and goes no further.
 */
public abstract class AbstractNotifier implements Notifier {
  private static final Logger log = LoggerFactory.getLogger(AbstractNotifier.class);

  @Override
  public final void backupSucceeded(String p_key, Path p_artifact, long p_size) {
    try {
      sendSuccess(p_key, p_artifact, p_size);
    } catch (Exception e) {
      log.error("Failed to send backup notification for {}", p_key, e);
    }
  }

  @Override
  public final void backupFailed(String p_error, String p_trace) {
    try {
      sendFailure(p_error, p_trace);
    } catch (Exception e) {
      log.error("Failed to send backup failure notification", e);
    }
  }

  protected abstract void sendSuccess(String p_key, Path p_artifact, long p_size) throws Exception;

  protected abstract void sendFailure(String p_error, String p_trace) throws Exception;

}
