package com.daveeberhart.db_util.secure_backup;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BadArgsException;
import com.daveeberhart.db_util.secure_backup.job.BackupJob;
import com.daveeberhart.db_util.secure_backup.job.DeleteJob;
import com.daveeberhart.db_util.secure_backup.job.HealthJob;
import com.daveeberhart.db_util.secure_backup.job.Job;
import com.daveeberhart.db_util.secure_backup.job.ListJob;
import com.daveeberhart.db_util.secure_backup.job.RestoreJob;
import com.daveeberhart.db_util.secure_backup.job.RetentionJob;
import com.daveeberhart.db_util.secure_backup.job.VerifyJob;

/**
 * Main class for the utility.
 */
public class Launcher {
  private static final String VERSION = "1.0";
  private static final String JAR = "secure-db-backup-all.jar";

  public static void main(String[] args) {
    new Launcher().run(args);
  }

  public void run(String[] args) {
    System.err.println("Secure database backups v." + VERSION);
    System.err.println();

    if (args.length < 2) {
      showUsageAndQuit();
      return;
    }

    try {
      Job job = createJob(args);

      Path scratchDir = Paths.get(args[1]);
      if (!Files.isDirectory(scratchDir)) {
        throw new BadArgsException("Scratch directory does not exist: " + scratchDir);
      }
      job.setScratchDir(scratchDir);

      job.setRemainingArgs(Arrays.asList(args).subList(2, args.length));
      try {
        job.prepare();
        job.run();
      } finally {
        job.cleanup();
      }
      System.out.println("Job execution completed normally.");
    } catch (BadArgsException e) {
      System.err.println(e.getMessage());
      System.err.println();
      showUsageAndQuit();
    } catch (BackupFailedException e) {
      System.out.flush();
      System.err.println();
      System.err.println("Job execution FAILED with the following error:");
      System.err.println(e.getMessage());

      if (Boolean.getBoolean("verbose")) {
        e.printStackTrace(System.err);
      }
      System.err.flush();

      exit(66);
    } catch (Exception e) {
      System.out.flush();
      System.err.println();
      System.err.println("Job execution FAILED with the following exception:");
      e.printStackTrace(System.err);
      System.err.flush();

      exit(99);
    }
  }

  protected Job createJob(String[] args) {
    Job job;
    switch (args[0].toLowerCase()) {
    case "backup":
      job = new BackupJob();
      break;
    case "restore":
      job = new RestoreJob();
      break;
    case "verify":
      job = new VerifyJob();
      break;
    case "list":
      job = new ListJob();
      break;
    case "delete":
      job = new DeleteJob();
      break;
    case "cleanup":
      job = new RetentionJob();
      break;
    case "health":
      job = new HealthJob();
      break;
    default:
      throw new BadArgsException("Unrecognized action: " + args[0]);
    }
    return job;
  }

  private void showUsageAndQuit() {
    System.err.println("Take encrypted, compressed database backups into S3 (or MinIO), and restore them on demand.");
    System.err.println();
    System.err.println("Usage:");
    System.err.println("  `java -jar " + JAR + " backup  /path/to/scratch/dir [name]`");
    System.err.println("  `java -jar " + JAR + " restore /path/to/scratch/dir backup_20250101_abcd1234.enc RESTORE-backup_20250101_abcd1234.enc [--drop-existing]`");
    System.err.println("  `java -jar " + JAR + " verify  /path/to/scratch/dir backup_20250101_abcd1234.enc`");
    System.err.println("  `java -jar " + JAR + " list    /path/to/scratch/dir`");
    System.err.println("  `java -jar " + JAR + " delete  /path/to/scratch/dir backup_20250101_abcd1234.enc`");
    System.err.println("  `java -jar " + JAR + " cleanup /path/to/scratch/dir [retentionDays [maxBackups]]`");
    System.err.println("  `java -jar " + JAR + " health  /path/to/scratch/dir`");
    System.err.println("Where:");
    System.err.println("  /path/to/scratch/dir holds temp files while a job runs (needs room for the dump)");
    System.err.println("  name is the backup name (default: backup_<date>_<random>)");
    System.err.println("  RESTORE-<key> confirms that you mean to overwrite the database");
    System.err.println("Settings are read from " + BackupConfig.DEFAULT_CONFIG_FILE + " (-Dconfig.file.location=... to change).");
    System.err.println("");
    exit(1);
  }

  protected void exit(int returnCode) {
    System.exit(returnCode);
  }
}
