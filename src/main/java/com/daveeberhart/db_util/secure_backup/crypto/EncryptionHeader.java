package com.daveeberhart.db_util.secure_backup.crypto;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

import org.apache.commons.io.IOUtils;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;

/**
 * The header written once at the start of an encrypted artifact.
 * <ul>
 * <li>v1: {@code [version:1][salt:16][base_nonce:8]}</li>
 * <li>legacy v0: {@code [salt:16][nonce:12]}, no version byte</li>
 * </ul>
 */
public final class EncryptionHeader {
  public static final int SALT_SIZE = 16;
  public static final int BASE_NONCE_SIZE = 8;
  public static final int LEGACY_NONCE_SIZE = 12;

  private final EncryptionFormat format;
  private final byte[] salt;
  private final byte[] nonce;

  public EncryptionHeader(EncryptionFormat p_format, byte[] p_salt, byte[] p_nonce) {
    int expectedNonce = p_format == EncryptionFormat.V1 ? BASE_NONCE_SIZE : LEGACY_NONCE_SIZE;
    if (p_salt.length != SALT_SIZE || p_nonce.length != expectedNonce) {
      throw new IllegalArgumentException("Bad " + p_format + " header: salt " + p_salt.length + " bytes, nonce " + p_nonce.length + " bytes");
    }
    format = p_format;
    salt = p_salt.clone();
    nonce = p_nonce.clone();
  }

  /**
   * Read the fields that follow the version byte (v1) or start the file (v0).
   */
  static EncryptionHeader read(EncryptionFormat p_format, InputStream p_in) throws IOException {
    byte[] salt = new byte[SALT_SIZE];
    byte[] nonce = new byte[p_format == EncryptionFormat.V1 ? BASE_NONCE_SIZE : LEGACY_NONCE_SIZE];
    try {
      IOUtils.readFully(p_in, salt);
      IOUtils.readFully(p_in, nonce);
    } catch (EOFException e) {
      throw new IntegrityCheckFailedException("Encrypted file is too short to hold a " + p_format + " header", e);
    }
    return new EncryptionHeader(p_format, salt, nonce);
  }

  void write(OutputStream p_out) throws IOException {
    if (format.getVersion() > 0) {
      p_out.write(format.getVersion());
    }
    p_out.write(salt);
    p_out.write(nonce);
  }

  public EncryptionFormat getFormat() {
    return format;
  }

  public byte getFormatVersion() {
    return (byte) format.getVersion();
  }

  public byte[] getSalt() {
    return salt.clone();
  }

  /**
   * @return the 8-byte base nonce (v1) or the whole 12-byte nonce (v0)
   */
  public byte[] getNonce() {
    return nonce.clone();
  }

  public int length() {
    return (format.getVersion() > 0 ? 1 : 0) + salt.length + nonce.length;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EncryptionHeader)) {
      return false;
    }
    EncryptionHeader other = (EncryptionHeader) o;
    return format == other.format && Arrays.equals(salt, other.salt) && Arrays.equals(nonce, other.nonce);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * format.hashCode() + Arrays.hashCode(salt)) + Arrays.hashCode(nonce);
  }

}
