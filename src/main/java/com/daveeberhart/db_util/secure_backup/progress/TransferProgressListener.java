package com.daveeberhart.db_util.secure_backup.progress;

import com.amazonaws.event.ProgressEvent;
import com.amazonaws.services.s3.transfer.PersistableTransfer;
import com.amazonaws.services.s3.transfer.internal.S3ProgressListener;

/**
 * Bridges TransferManager progress events onto a {@link ProgressReporter}.
 */
public class TransferProgressListener extends ProgressReporter implements S3ProgressListener {
  /** 64MB */
  private static final long REPORT_INTERVAL = 64L * 1024 * 1024;

  public TransferProgressListener(String caption, String action, long totalBytes) {
    super(caption, action, totalBytes, REPORT_INTERVAL);
  }

  @Override
  public void progressChanged(ProgressEvent p_progressEvent) {
    if (p_progressEvent.getBytesTransferred() > 0) {
      addBytesProcessed(p_progressEvent.getBytesTransferred());
    }
  }

  @Override
  public void onPersistableTransfer(PersistableTransfer p_persistableTransfer) {
    // Nop: we never resume transfers.
  }

}
