package com.daveeberhart.db_util.secure_backup.pipeline;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

import org.bouncycastle.util.encoders.Hex;

import com.daveeberhart.db_util.secure_backup.storage.BackupArtifact;

/**
 * Naming rules for backup objects.
 * <p>
 * Generated names are {@code backup_<yyyyMMdd>_<8 random hex>}: the date keeps them readable, the
 * random part keeps the exact backup time out of the object name.
 */
public final class BackupKeys {
  private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]{1,100}");
  private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_-]{1,100}\\.enc");
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
  private static final String CONFIRMATION_PREFIX = "RESTORE-";

  private static final SecureRandom random = new SecureRandom();

  private BackupKeys() {
  }

  public static String generateName(Clock p_clock) {
    byte[] id = new byte[4];
    random.nextBytes(id);
    return "backup_" + LocalDate.now(p_clock).format(DATE) + "_" + Hex.toHexString(id);
  }

  public static String toKey(String p_name) {
    return p_name + BackupArtifact.SUFFIX;
  }

  public static boolean isValidName(String p_name) {
    return p_name != null && SAFE_NAME.matcher(p_name).matches();
  }

  /**
   * Only letters, digits, {@code _} and {@code -}, ending in {@code .enc}; no path separators or
   * {@code ..} can get through.
   */
  public static boolean isValidKey(String p_key) {
    return p_key != null && SAFE_KEY.matcher(p_key).matches();
  }

  /**
   * @return the exact text an operator must supply to restore over the live database
   */
  public static String confirmationFor(String p_key) {
    return CONFIRMATION_PREFIX + p_key;
  }

}
