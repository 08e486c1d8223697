package com.daveeberhart.db_util.secure_backup.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the progress of a long-running byte-oriented operation (crypto, compression, transfer)
 * every {@code reportInterval} bytes, plus a final 100% line if anything was reported.
 */
public class ProgressReporter {
  private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

  /** 256MB */
  public static final long DEFAULT_REPORT_INTERVAL = 256L * 1024 * 1024;

  private final long reportInterval;
  private final String action;
  private final String caption;
  private final long totalBytes;

  private long totalBytesProcessed;
  private long nextReport;
  private boolean reportedAnything = false;
  private boolean hit100 = false;

  public ProgressReporter(String caption, String action, long totalBytes) {
    this(caption, action, totalBytes, DEFAULT_REPORT_INTERVAL);
  }

  public ProgressReporter(String caption, String action, long totalBytes, long reportInterval) {
    this.reportInterval = reportInterval;
    this.caption = caption;
    this.action = action;
    this.totalBytes = Math.max(1, totalBytes); // Avoid div/0 for empty inputs.
    nextReport = reportInterval;
  }

  public void addBytesProcessed(long bytes) {
    totalBytesProcessed += bytes;
    reportProgress(totalBytesProcessed);
  }

  protected void reportProgress(long processed) {
    if (nextReport <= processed) {
      reportedAnything = true;
      nextReport = processed + reportInterval;

      long percent = Math.min(100, Math.round((100d * processed) / totalBytes));
      if (percent == 100) {
        hit100 = true;
      }
      log.info("[{}] {} {}% ({} of {} bytes)", caption, action, percent, processed, totalBytes);
    }
  }

  public long getTotalBytesProcessed() {
    return totalBytesProcessed;
  }

  public void done() {
    if (reportedAnything && !hit100) {
      nextReport = 0;
      reportProgress(totalBytes);
    }
  }

}
