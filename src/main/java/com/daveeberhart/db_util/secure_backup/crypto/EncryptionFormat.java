package com.daveeberhart.db_util.secure_backup.crypto;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import org.apache.commons.io.IOUtils;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.IntegrityCheckFailedException;

/**
 * The on-disk formats an encrypted artifact may be in.
 * <p>
 * The first byte of a file is resolved once into one of these constants, which then owns the
 * whole parse/decrypt of the file.  A new format is a new constant.
 */
public enum EncryptionFormat {

  /**
   * Pre-chunking archives: {@code [salt:16][nonce:12][ciphertext][tag:16]}, one AES-GCM call for
   * the whole body.  Read-only; nothing is written in this format any more.
   */
  LEGACY_V0(0) {
    @Override
    void decryptBody(InputStream p_in, OutputStream p_out, KeyDeriver p_kdf, int p_chunkSize) throws IOException {
      EncryptionHeader header = EncryptionHeader.read(this, p_in);
      byte[] ciphertext = IOUtils.toByteArray(p_in);
      if (ciphertext.length < TAG_SIZE) {
        throw new IntegrityCheckFailedException("Legacy archive is too short to hold an authentication tag");
      }

      GCMBlockCipher cipher = createCipher(p_kdf.deriveKey(header.getSalt()), header.getNonce(), false);
      byte[] plaintext = new byte[cipher.getOutputSize(ciphertext.length)];
      int len = cipher.processBytes(ciphertext, 0, ciphertext.length, plaintext, 0);
      try {
        len += cipher.doFinal(plaintext, len);
      } catch (InvalidCipherTextException e) {
        throw new IntegrityCheckFailedException("Legacy archive failed integrity check (tampered, or wrong encryption key)", e);
      }
      // Only written once the tag has been checked.
      p_out.write(plaintext, 0, len);
    }

    @Override
    void decryptBodyUnbuffered(InputStream p_in, OutputStream p_out, KeyDeriver p_kdf, int p_chunkSize) throws IOException {
      EncryptionHeader header = EncryptionHeader.read(this, p_in);
      GCMBlockCipher cipher = createCipher(p_kdf.deriveKey(header.getSalt()), header.getNonce(), false);

      // BouncyCastle's GCM holds back less than a block plus the tag, so one read never yields
      // more than p_chunkSize + TAG_SIZE bytes.
      byte[] inbuff = new byte[p_chunkSize];
      byte[] outbuff = new byte[p_chunkSize + TAG_SIZE];
      long total = 0;
      int lenIn;
      while ((lenIn = p_in.read(inbuff)) >= 0) {
        int lenOut = cipher.processBytes(inbuff, 0, lenIn, outbuff, 0);
        p_out.write(outbuff, 0, lenOut);
        total += lenIn;
      }
      if (total < TAG_SIZE) {
        throw new IntegrityCheckFailedException("Legacy archive is too short to hold an authentication tag");
      }

      byte[] finalBuff = new byte[cipher.getOutputSize(0)];
      int lenOut;
      try {
        lenOut = cipher.doFinal(finalBuff, 0);
      } catch (InvalidCipherTextException e) {
        throw new IntegrityCheckFailedException("Legacy archive failed integrity check (tampered, or wrong encryption key)", e);
      }
      p_out.write(finalBuff, 0, lenOut);
    }

    @Override
    int minimumLength() {
      return EncryptionHeader.SALT_SIZE + EncryptionHeader.LEGACY_NONCE_SIZE + TAG_SIZE;
    }
  },

  /**
   * {@code [0x01][salt:16][base_nonce:8]} followed by chunks.  Chunk <i>i</i> is the AES-GCM
   * encryption of plaintext chunk <i>i</i> under nonce {@code base_nonce || u32be(i)}, i.e.
   * {@code ciphertext || tag:16}.  Every chunk but the last holds exactly one full chunk of
   * plaintext.
   * <p>
   * There is no final-chunk marker: a stream cut exactly between two chunks decrypts cleanly to a
   * prefix of the plaintext.  Artifacts always wrap an XZ stream, whose index and check fail on
   * such a prefix when it is decompressed to the end, which is what restore does.
   */
  V1(1) {
    @Override
    void decryptBody(InputStream p_in, OutputStream p_out, KeyDeriver p_kdf, int p_chunkSize) throws IOException {
      EncryptionHeader header = EncryptionHeader.read(this, p_in);
      KeyParameter key = p_kdf.deriveKey(header.getSalt());
      byte[] baseNonce = header.getNonce();

      byte[] inbuff = new byte[p_chunkSize + TAG_SIZE];
      byte[] outbuff = new byte[p_chunkSize + TAG_SIZE];
      long counter = 0;
      int lenIn;
      while ((lenIn = IOUtils.read(p_in, inbuff)) > 0) {
        if (lenIn < TAG_SIZE) {
          throw new IntegrityCheckFailedException("Chunk " + counter + " is truncated (" + lenIn + " bytes)");
        }
        GCMBlockCipher cipher = createCipher(key, chunkNonce(baseNonce, counter), false);
        int lenOut = cipher.processBytes(inbuff, 0, lenIn, outbuff, 0);
        try {
          lenOut += cipher.doFinal(outbuff, lenOut);
        } catch (InvalidCipherTextException e) {
          throw new IntegrityCheckFailedException("Chunk " + counter + " failed integrity check (tampered, or wrong encryption key)", e);
        }
        p_out.write(outbuff, 0, lenOut);
        counter++;
      }
    }

    @Override
    int minimumLength() {
      return 1 + EncryptionHeader.SALT_SIZE + EncryptionHeader.BASE_NONCE_SIZE + TAG_SIZE;
    }
  };

  /** Size of the auth tag in bits.  This is the max length allowed (strongest anti-forgery). */
  static final int TAG_SIZE_BITS = 128;
  public static final int TAG_SIZE = TAG_SIZE_BITS / Byte.SIZE;
  /** Largest chunk counter that fits in the 4-byte nonce suffix. */
  static final long MAX_CHUNK_COUNTER = 0xFFFFFFFFL;

  private final int version;

  EncryptionFormat(int p_version) {
    version = p_version;
  }

  public int getVersion() {
    return version;
  }

  /**
   * Decrypt everything after the version byte (v1) or from the start of the file (v0).
   * Plaintext is written only after the authentication tag covering it has been verified.
   */
  abstract void decryptBody(InputStream p_in, OutputStream p_out, KeyDeriver p_kdf, int p_chunkSize) throws IOException;

  /**
   * Same as {@link #decryptBody}, but memory stays bounded by the chunk size for every format.
   * Plaintext may reach {@code p_out} before its tag has been checked, so the caller must discard
   * the output when this throws.
   */
  void decryptBodyUnbuffered(InputStream p_in, OutputStream p_out, KeyDeriver p_kdf, int p_chunkSize) throws IOException {
    decryptBody(p_in, p_out, p_kdf, p_chunkSize);
  }

  /**
   * @return the smallest file that could possibly be a valid artifact in this format
   */
  abstract int minimumLength();

  /**
   * Resolve the first byte of a file.  Anything but a known version byte is taken to be the
   * first salt byte of a legacy archive.
   */
  public static EncryptionFormat forVersionByte(int p_firstByte) {
    return p_firstByte == V1.version ? V1 : LEGACY_V0;
  }

  /**
   * @return the 12-byte nonce for chunk {@code p_counter}: {@code base_nonce || u32be(counter)}
   */
  public static byte[] chunkNonce(byte[] p_baseNonce, long p_counter) {
    if (p_counter < 0 || p_counter > MAX_CHUNK_COUNTER) {
      throw new IllegalStateException("Chunk counter out of range: " + p_counter);
    }
    return ByteBuffer.allocate(EncryptionHeader.BASE_NONCE_SIZE + Integer.BYTES)
        .put(p_baseNonce)
        .putInt((int) p_counter)
        .array();
  }

  static GCMBlockCipher createCipher(KeyParameter p_key, byte[] p_nonce, boolean p_forEncryption) {
    GCMBlockCipher cipher = new GCMBlockCipher(new AESEngine());
    cipher.init(p_forEncryption, new AEADParameters(p_key, TAG_SIZE_BITS, p_nonce));
    return cipher;
  }

}
