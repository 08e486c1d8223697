package com.daveeberhart.db_util.secure_backup.tool;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ConfigurationException;

/**
 * One invocation of an external program.  Stdout is discarded; stderr is captured in full and
 * returned once the process has exited.
 */
public class ToolCommand {
  private final List<String> command;
  private final Map<String, String> extraEnv;
  private final List<String> removedEnv;

  public ToolCommand(List<String> p_command, Map<String, String> p_extraEnv, List<String> p_removedEnv) {
    command = Collections.unmodifiableList(new ArrayList<>(p_command));
    extraEnv = p_extraEnv;
    removedEnv = p_removedEnv;
  }

  public List<String> getCommand() {
    return command;
  }

  /**
   * Start the process and wait for it.
   *
   * @return exit code and captured stderr
   */
  public Outcome run() {
    ProcessBuilder pb = new ProcessBuilder(command);
    removedEnv.forEach(pb.environment()::remove);
    pb.environment().putAll(extraEnv);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

    Process proc;
    try {
      proc = pb.start();
    } catch (IOException e) {
      throw new ConfigurationException("Could not run " + command.get(0) + " (is it installed and on the PATH?): " + e.getMessage());
    }

    try (InputStream err = proc.getErrorStream()) {
      proc.getOutputStream().close();
      String stderr = IOUtils.toString(err, StandardCharsets.UTF_8);
      int exitCode = proc.waitFor();
      return new Outcome(exitCode, stderr);
    } catch (IOException e) {
      proc.destroyForcibly();
      throw new BackupFailedException("Lost the error stream of " + command.get(0), e);
    } catch (InterruptedException e) {
      proc.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new BackupFailedException("Thread interrupted while waiting for " + command.get(0), e);
    }
  }

  /**
   * @return whether {@code p_tool} names an executable file, either directly or via the PATH
   */
  public static boolean isExecutableAvailable(String p_tool) {
    if (p_tool.contains(File.separator)) {
      return Files.isExecutable(Paths.get(p_tool));
    }
    String path = System.getenv("PATH");
    if (path == null) {
      return false;
    }
    for (String dir : path.split(File.pathSeparator)) {
      if (!dir.isEmpty()) {
        Path candidate = Paths.get(dir, p_tool);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return true;
        }
      }
    }
    return false;
  }

  public static final class Outcome {
    private final int exitCode;
    private final String stderr;

    public Outcome(int p_exitCode, String p_stderr) {
      exitCode = p_exitCode;
      stderr = p_stderr;
    }

    public int getExitCode() {
      return exitCode;
    }

    public String getStderr() {
      return stderr;
    }
  }

}
