package com.daveeberhart.db_util.secure_backup.crypto;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import org.apache.commons.io.IOUtils;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.ConfigurationException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;
import com.daveeberhart.db_util.secure_backup.progress.ProgressReporter;

/**
 * Chunked AES-256-GCM encryption of streams too large to hold in memory.
 * <p>
 * Every call to {@link #encrypt(InputStream, OutputStream)} draws a fresh salt (hence a fresh
 * derived key) and a fresh base nonce.  Within an artifact, chunk <i>i</i> is sealed under nonce
 * {@code base_nonce || u32be(i)}, so no nonce ever repeats under a key.  Decryption reads the
 * format from the first byte; see {@link EncryptionFormat}.
 * <p>
 * Chunks are processed strictly in counter order on both sides.
 * <p>
 * The format carries no end-of-stream marker, so a file cut exactly on a chunk boundary decrypts
 * to a prefix of the plaintext.  The XZ container inside catches that on decompression.
 */
public class StreamCipher {
  private static final Logger log = LoggerFactory.getLogger(StreamCipher.class);

  /** 1MB: bounds memory use regardless of input size. */
  public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

  private final SecureRandom random = new SecureRandom();
  private final KeyDeriver kdf;
  private final String keyId;
  private final int chunkSize;

  public StreamCipher(String p_masterKey, String p_keyId) {
    this(p_masterKey, p_keyId, KeyDeriver.DEFAULT_ITERATIONS, DEFAULT_CHUNK_SIZE);
  }

  /**
   * @param p_masterKey long-lived master secret, at least {@value BackupConfig#MIN_KEY_LENGTH} characters
   * @param p_keyId identifier of the master secret, logged with every encryption
   * @param p_iterations PBKDF2 rounds
   * @param p_chunkSize plaintext bytes per chunk
   */
  public StreamCipher(String p_masterKey, String p_keyId, int p_iterations, int p_chunkSize) {
    if (p_masterKey == null || p_masterKey.length() < BackupConfig.MIN_KEY_LENGTH) {
      throw new ConfigurationException("Master key must be at least " + BackupConfig.MIN_KEY_LENGTH + " characters");
    }
    if (p_chunkSize < 1) {
      throw new IllegalArgumentException("Chunk size must be positive; was " + p_chunkSize);
    }
    kdf = new KeyDeriver(p_masterKey, p_iterations);
    keyId = p_keyId;
    chunkSize = p_chunkSize;
  }

  public String getKeyId() {
    return keyId;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Encrypt {@code p_in} into {@code p_out} in the current ({@link EncryptionFormat#V1}) format.
   * Neither stream is closed.
   *
   * @return the header that was written
   */
  public EncryptionHeader encrypt(InputStream p_in, OutputStream p_out) throws IOException {
    return encrypt(p_in, p_out, null);
  }

  private EncryptionHeader encrypt(InputStream p_in, OutputStream p_out, ProgressReporter p_progress) throws IOException {
    byte[] salt = new byte[EncryptionHeader.SALT_SIZE];
    byte[] baseNonce = new byte[EncryptionHeader.BASE_NONCE_SIZE];
    random.nextBytes(salt);
    random.nextBytes(baseNonce);

    EncryptionHeader header = new EncryptionHeader(EncryptionFormat.V1, salt, baseNonce);
    KeyParameter key = kdf.deriveKey(salt);
    header.write(p_out);

    final byte[] inbuff = new byte[chunkSize];
    final byte[] outbuff = new byte[chunkSize + EncryptionFormat.TAG_SIZE];
    long counter = 0;
    int lenIn;
    while ((lenIn = IOUtils.read(p_in, inbuff)) > 0) {
      GCMBlockCipher cipher = EncryptionFormat.createCipher(key, EncryptionFormat.chunkNonce(baseNonce, counter), true);
      int lenOut = cipher.processBytes(inbuff, 0, lenIn, outbuff, 0);
      try {
        lenOut += cipher.doFinal(outbuff, lenOut);
      } catch (InvalidCipherTextException e) {
        throw new IllegalStateException("InvalidCipherTextException is not expected while encrypting!", e);
      }
      p_out.write(outbuff, 0, lenOut);
      counter++;
      if (p_progress != null) {
        p_progress.addBytesProcessed(lenIn);
      }
    }

    log.debug("Encrypted {} chunks (key_id={})", counter, keyId);
    return header;
  }

  /**
   * Decrypt {@code p_in} into {@code p_out}, detecting the format from the first byte.
   * <p>
   * Each v1 chunk is written only after its tag verifies; a legacy archive is written only after
   * its single tag verifies, so a legacy archive is held in memory in full.
   * <p>
   * On an {@link IntegrityCheckFailedException}, chunks before the failing one may already have
   * been written.  Callers must discard everything written to {@code p_out} when this throws;
   * {@link #decrypt(Path, Path)} does that for files.
   */
  public void decrypt(InputStream p_in, OutputStream p_out) throws IOException {
    PushbackInputStream in = new PushbackInputStream(p_in, 1);
    int first = in.read();
    if (first < 0) {
      throw new IntegrityCheckFailedException("Encrypted stream is empty");
    }

    EncryptionFormat format = EncryptionFormat.forVersionByte(first);
    if (format == EncryptionFormat.LEGACY_V0) {
      in.unread(first);
    }
    format.decryptBody(in, p_out, kdf, chunkSize);
  }

  /**
   * Encrypt a file.  The output is overwritten.
   */
  public EncryptionHeader encrypt(Path p_in, Path p_out) throws IOException {
    ProgressReporter progress = new ProgressReporter(p_in.getFileName().toString(), "Encrypt", Files.size(p_in));
    try (InputStream fin = new BufferedInputStream(Files.newInputStream(p_in));
         OutputStream fout = new BufferedOutputStream(Files.newOutputStream(p_out))) {
      EncryptionHeader header = encrypt(fin, fout, progress);
      progress.done();
      log.info("Encrypted {} -> {} ({} bytes, key_id={})", p_in.getFileName(), p_out.getFileName(), Files.size(p_in), keyId);
      return header;
    }
  }

  /**
   * Decrypt a file.  If decryption fails for any reason the output file is deleted, so no
   * partially decrypted plaintext is left on disk.  Memory use is bounded by the chunk size for
   * both formats.
   */
  public void decrypt(Path p_in, Path p_out) throws IOException {
    EncryptionFormat format = EncryptionFormat.forVersionByte(readFirstByte(p_in));
    try {
      try {
        decryptFile(format, p_in, p_out);
      } catch (IntegrityCheckFailedException e) {
        // A legacy salt starts with 0x01 one time in 256.  Worth a second try, but only when the
        // v1 attempt emitted nothing.  The retry streams, so a large v1 file with the wrong key
        // costs a second pass over the disk, not its size in heap.
        if (format != EncryptionFormat.V1 || Files.size(p_out) > 0) {
          throw e;
        }
        try {
          decryptFile(EncryptionFormat.LEGACY_V0, p_in, p_out);
          log.info("{} decrypted as a legacy archive", p_in.getFileName());
        } catch (IntegrityCheckFailedException legacyFailure) {
          e.addSuppressed(legacyFailure);
          throw e;
        }
      }
    } catch (IOException | RuntimeException e) {
      // IMPORTANT: Decrypted contents failed the auth check; DON'T leave them lying about!
      Files.deleteIfExists(p_out);
      throw e;
    }
    log.info("Decrypted {} -> {}", p_in.getFileName(), p_out.getFileName());
  }

  private void decryptFile(EncryptionFormat p_format, Path p_in, Path p_out) throws IOException {
    try (InputStream fin = new BufferedInputStream(Files.newInputStream(p_in));
         OutputStream fout = new BufferedOutputStream(Files.newOutputStream(p_out))) {
      if (p_format != EncryptionFormat.LEGACY_V0) {
        fin.read();
      }
      // decrypt(Path, Path) deletes p_out on failure, so unverified legacy plaintext never survives.
      p_format.decryptBodyUnbuffered(fin, fout, kdf, chunkSize);
    }
  }

  /**
   * Cheap structural check: the header parses and the file is long enough to hold at least one
   * tag.  Does not decrypt anything.
   */
  public boolean verify(Path p_path) {
    try {
      long size = Files.size(p_path);
      EncryptionFormat format = EncryptionFormat.forVersionByte(readFirstByte(p_path));
      if (size < format.minimumLength()) {
        log.warn("{} is too short ({} bytes) to be a {} archive", p_path.getFileName(), size, format);
        return false;
      }
      try (InputStream in = Files.newInputStream(p_path)) {
        if (format != EncryptionFormat.LEGACY_V0) {
          in.read();
        }
        EncryptionHeader.read(format, in);
      }
      return true;
    } catch (IOException | IntegrityCheckFailedException e) {
      log.error("Verification of {} failed: {}", p_path.getFileName(), e.getMessage());
      return false;
    }
  }

  /**
   * @return the format version of an encrypted file: 1 for the current format, 0 for legacy
   */
  public int getFormatVersion(Path p_path) throws IOException {
    return EncryptionFormat.forVersionByte(readFirstByte(p_path)).getVersion();
  }

  private static int readFirstByte(Path p_path) throws IOException {
    try (InputStream in = Files.newInputStream(p_path)) {
      int first = in.read();
      if (first < 0) {
        throw new IntegrityCheckFailedException(p_path.getFileName() + " is empty; not an encrypted backup file");
      }
      return first;
    }
  }

}
