package com.daveeberhart.db_util.secure_backup.tool;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ToolExecutionException;
import com.daveeberhart.db_util.secure_backup.fs.CredentialsFile;

/**
 * {@link DatabaseTool} backed by {@code pg_dump} / {@code pg_restore} (or compatible tools).
 * <p>
 * The password goes into a 0600 password file that only lives for the duration of the
 * subprocess; the child finds it through {@value #PASSFILE_ENV}.  {@code PGPASSWORD} is stripped
 * from the child environment.
 */
public class PostgresTool implements DatabaseTool {
  private static final Logger log = LoggerFactory.getLogger(PostgresTool.class);

  static final String PASSFILE_ENV = "PGPASSFILE";
  private static final List<String> STRIPPED_ENV = Arrays.asList("PGPASSWORD");
  private static final String CREDENTIALS_FILE = ".pgpass";

  private final String host;
  private final int port;
  private final String database;
  private final String user;
  private final String password;
  private final String dumpTool;
  private final String restoreTool;

  public PostgresTool(String p_host, int p_port, String p_database, String p_user, String p_password,
      String p_dumpTool, String p_restoreTool) {
    host = p_host;
    port = p_port;
    database = p_database;
    user = p_user;
    password = p_password;
    dumpTool = p_dumpTool;
    restoreTool = p_restoreTool;
  }

  public static PostgresTool fromConfig(BackupConfig p_config) {
    return new PostgresTool(
        p_config.get(BackupConfig.DB_HOST, "localhost"),
        p_config.getInt(BackupConfig.DB_PORT, 5432),
        p_config.getRequired(BackupConfig.DB_NAME),
        p_config.getRequired(BackupConfig.DB_USER),
        p_config.get(BackupConfig.DB_PASSWORD, ""),
        p_config.get(BackupConfig.DB_DUMP_TOOL, "pg_dump"),
        p_config.get(BackupConfig.DB_RESTORE_TOOL, "pg_restore"));
  }

  @Override
  public void dump(Path p_out, Path p_workDir) {
    ToolCommand.Outcome outcome = runWithCredentials(dumpCommand(p_out), p_workDir);
    if (outcome.getExitCode() != 0) {
      throw new ToolExecutionException(dumpTool, outcome.getExitCode(), outcome.getStderr().trim());
    }
    try {
      log.info("{} completed: {} bytes", dumpTool, Files.size(p_out));
    } catch (IOException e) {
      throw new UncheckedIOException(dumpTool + " reported success but wrote no dump file", e);
    }
  }

  @Override
  public void restore(Path p_dump, boolean p_dropExisting, Path p_workDir) {
    ToolCommand.Outcome outcome = runWithCredentials(restoreCommand(p_dump, p_dropExisting), p_workDir);
    if (outcome.getExitCode() != 0) {
      if (!isTolerableRestoreFailure(outcome.getStderr())) {
        throw new ToolExecutionException(restoreTool, outcome.getExitCode(), outcome.getStderr().trim());
      }
      log.warn("{} warnings: {}", restoreTool, outcome.getStderr().trim());
    }
    log.info("{} completed", restoreTool);
  }

  List<String> dumpCommand(Path p_out) {
    List<String> cmd = new ArrayList<>();
    cmd.add(dumpTool);
    cmd.add("--format=custom");
    cmd.add("--no-password");
    cmd.addAll(connectionArgs());
    cmd.add("--file=" + p_out);
    return cmd;
  }

  List<String> restoreCommand(Path p_dump, boolean p_dropExisting) {
    List<String> cmd = new ArrayList<>();
    cmd.add(restoreTool);
    cmd.add("--no-password");
    cmd.addAll(connectionArgs());
    cmd.add("--no-owner");
    cmd.add("--no-privileges");
    if (p_dropExisting) {
      cmd.add("--clean");
    }
    cmd.add(p_dump.toString());
    return cmd;
  }

  private List<String> connectionArgs() {
    return Arrays.asList(
        "--host=" + host,
        "--port=" + port,
        "--username=" + user,
        "--dbname=" + database);
  }

  private ToolCommand.Outcome runWithCredentials(List<String> p_command, Path p_workDir) {
    try (CredentialsFile creds = CredentialsFile.pgpass(p_workDir.resolve(CREDENTIALS_FILE), host, port, database, user, password)) {
      log.info("Running {}", p_command.get(0));
      return new ToolCommand(p_command, Collections.singletonMap(PASSFILE_ENV, creds.getPath().toString()), STRIPPED_ENV).run();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not write credentials file in " + p_workDir, e);
    }
  }

  /**
   * A restore that exits non-zero is still acceptable when every error it reports is about an
   * object that already exists (re-applying a dump onto a live schema).
   */
  static boolean isTolerableRestoreFailure(String p_stderr) {
    List<String> errors = Arrays.stream(p_stderr.split("\\R"))
        .filter(line -> line.toLowerCase(Locale.ROOT).contains("error:"))
        .collect(Collectors.toList());
    return !errors.isEmpty() && errors.stream().allMatch(line -> line.contains("already exists"));
  }

  @Override
  public boolean isDumpToolAvailable() {
    return ToolCommand.isExecutableAvailable(dumpTool);
  }

  @Override
  public boolean isRestoreToolAvailable() {
    return ToolCommand.isExecutableAvailable(restoreTool);
  }

}
