package com.daveeberhart.db_util.secure_backup.job;

import java.util.List;

import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.storage.BackupArtifact;

/**
 * Print the stored backups, newest first.
 */
public class ListJob extends Job {

  @Override
  public void setRemainingArgs(List<String> p_args) {
    if (!p_args.isEmpty()) {
      throw new BadArgsException("list takes no arguments");
    }
  }

  @Override
  public void run() {
    List<BackupArtifact> artifacts = store.list();
    for (BackupArtifact artifact : artifacts) {
      System.out.println(String.format("%-40s %14d  %s", artifact.getKey(), artifact.getSize(), artifact.getCreatedAt()));
    }
    System.out.println(artifacts.size() + " backup(s)");
  }

}
