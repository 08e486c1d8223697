package com.daveeberhart.db_util.secure_backup.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ConfigurationException;

/**
 * Settings for the backup utility.
 * <p>
 * Values come from a properties file (default {@value #DEFAULT_CONFIG_FILE}, override with
 * {@code -Dconfig.file.location=...}).  A system property of the same name always wins, so any
 * setting can be passed on the command line as {@code -Dname=value}.
 */
public class BackupConfig {
  public static final String DEFAULT_CONFIG_FILE = "/etc/secure-db-backup/backup.properties";

  public static final String ENCRYPTION_KEY = "encryption.key";
  public static final String ENCRYPTION_KEY_ID = "encryption.keyId";
  public static final String AWS_REGION = "aws.region";
  public static final String AWS_ACCESS_KEY = "aws.accessKeyId";
  public static final String AWS_SECRET_KEY = "aws.secretKeyId";
  public static final String AWS_BUCKET = "aws.bucket";
  public static final String S3_ENDPOINT = "s3.endpoint";
  public static final String DB_HOST = "db.host";
  public static final String DB_PORT = "db.port";
  public static final String DB_NAME = "db.name";
  public static final String DB_USER = "db.user";
  public static final String DB_PASSWORD = "db.password";
  public static final String DB_DUMP_TOOL = "db.dumpTool";
  public static final String DB_RESTORE_TOOL = "db.restoreTool";
  public static final String RETENTION_DAYS = "backup.retentionDays";
  public static final String MAX_BACKUPS = "backup.maxBackups";
  public static final String TELEGRAM_BOT_TOKEN = "notify.telegram.botToken";
  public static final String TELEGRAM_CHAT_ID = "notify.telegram.chatId";
  public static final String SEND_BACKUP_FILE = "notify.sendBackupFile";

  /** Shortest master secret we accept. */
  public static final int MIN_KEY_LENGTH = 32;

  private final Properties fileProps;
  private final String source;

  public BackupConfig(Properties p_fileProps, String p_source) {
    fileProps = p_fileProps;
    source = p_source;
  }

  /**
   * Load the config file named by {@code config.file.location}.  A missing file is not an
   * error; every setting may still arrive as a system property.
   */
  public static BackupConfig load() {
    File configFile = new File(System.getProperty("config.file.location", DEFAULT_CONFIG_FILE));
    Properties props = new Properties();
    if (configFile.exists()) {
      try (FileInputStream fs = new FileInputStream(configFile)) {
        props.load(fs);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return new BackupConfig(props, configFile.getAbsolutePath());
  }

  /**
   * @return whether the config file was found and read at all
   */
  public boolean hasFileSettings() {
    return !fileProps.isEmpty();
  }

  public String getSource() {
    return source;
  }

  /**
   * @param p_prop The name of the property to load
   * @return The property's value, preferring properties set via the commandline, or null.
   */
  public String get(String p_prop) {
    String val = System.getProperty(p_prop);
    if (val == null) {
      val = fileProps.getProperty(p_prop);
    }
    if (val == null || val.trim().isEmpty()) {
      return null;
    }
    return val.trim();
  }

  public String get(String p_prop, String p_default) {
    String val = get(p_prop);
    return val == null ? p_default : val;
  }

  public String getRequired(String p_prop) {
    String val = get(p_prop);
    if (val == null) {
      throw new ConfigurationException("A value is required for the setting " + p_prop
          + ". Either add it to " + source + ", or pass it on the command line (e.g. -D" + p_prop + "=\"value\")");
    }
    return val;
  }

  public int getInt(String p_prop, int p_default) {
    String val = get(p_prop);
    if (val == null) {
      return p_default;
    }
    try {
      return Integer.parseInt(val);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Setting " + p_prop + " must be an integer; was " + val);
    }
  }

  public boolean getBoolean(String p_prop, boolean p_default) {
    String val = get(p_prop);
    return val == null ? p_default : Boolean.parseBoolean(val);
  }

  /**
   * @return the master secret, checked for presence and minimum length
   */
  public String getEncryptionKey() {
    String key = getRequired(ENCRYPTION_KEY);
    if (key.length() < MIN_KEY_LENGTH) {
      throw new ConfigurationException(ENCRYPTION_KEY + " must be at least " + MIN_KEY_LENGTH + " characters");
    }
    return key;
  }

  public String getEncryptionKeyId() {
    return get(ENCRYPTION_KEY_ID, "default");
  }

  public String getBucket() {
    return get(AWS_BUCKET, "edu-backups");
  }

  public int getRetentionDays() {
    return getInt(RETENTION_DAYS, 30);
  }

  public int getMaxBackups() {
    return getInt(MAX_BACKUPS, 10);
  }

}
