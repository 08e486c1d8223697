package com.daveeberhart.db_util.secure_backup.crypto;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Derive a per-artifact AES key from the master secret using PBKDF2-HMAC-SHA256.
 * <p>
 * The salt is fresh for every artifact, so every backup gets its own key even though the master
 * secret never changes.
 */
public class KeyDeriver {
  /** OWASP recommendation for PBKDF2-SHA256. */
  public static final int DEFAULT_ITERATIONS = 480_000;
  public static final int KEY_SIZE_BITS = 256;

  private final byte[] masterSecret;
  private final int iterations;

  public KeyDeriver(String p_masterSecret, int p_iterations) {
    if (p_iterations < 1) {
      throw new IllegalArgumentException("PBKDF2 iteration count must be positive; was " + p_iterations);
    }
    masterSecret = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(p_masterSecret.toCharArray());
    iterations = p_iterations;
  }

  public KeyParameter deriveKey(byte[] p_salt) {
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(masterSecret, p_salt, iterations);
    return (KeyParameter) gen.generateDerivedParameters(KEY_SIZE_BITS);
  }

  public int getIterations() {
    return iterations;
  }

}
