package com.daveeberhart.db_util.secure_backup.notify;

import java.nio.file.Path;

/**
 * Operator channel for backup outcomes.
 * <p>
 * Delivery is best effort: implementations never throw.  A failed notification is logged by the
 * notifier itself and is never seen by the caller.
 */
public interface Notifier {

  /**
   * @param p_artifact the encrypted artifact, still on local disk for the duration of the call
   */
  void backupSucceeded(String p_key, Path p_artifact, long p_size);

  /**
   * @param p_trace full stack trace; sent as an attachment, not inlined
   */
  void backupFailed(String p_error, String p_trace);

}
