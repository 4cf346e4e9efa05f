//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.crypto;

import java.security.SecureRandom;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.AEADBlockCipher;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.InvalidMessageException;

/**
 * AES-256-GCM with a 96-bit nonce and a 128-bit tag. The tag is appended to the ciphertext, as in
 * most AEAD APIs; wire formats that carry it separately split it off with {@link #TAG_SIZE}.
 */
public final class Aes256Gcm {
  public static final int KEY_SIZE = 32;
  public static final int NONCE_SIZE = 12;
  public static final int TAG_SIZE = 16;

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private Aes256Gcm() {}

  public static byte[] generateNonce() {
    byte[] nonce = new byte[NONCE_SIZE];
    SECURE_RANDOM.nextBytes(nonce);
    return nonce;
  }

  public static byte[] encrypt(byte[] key, byte[] nonce, byte[] plaintext, byte[] associatedData) {
    AEADBlockCipher cipher = newCipher(true, key, nonce, associatedData);
    byte[] output = new byte[cipher.getOutputSize(plaintext.length)];
    int written = cipher.processBytes(plaintext, 0, plaintext.length, output, 0);
    try {
      cipher.doFinal(output, written);
    } catch (InvalidCipherTextException e) {
      throw new AssertionError(e);
    }
    return output;
  }

  public static byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertext, byte[] associatedData)
      throws InvalidMessageException {
    if (ciphertext.length < TAG_SIZE) {
      throw new InvalidMessageException(ErrorCode.DECRYPTION_FAILED, "ciphertext too short");
    }
    AEADBlockCipher cipher = newCipher(false, key, nonce, associatedData);
    byte[] output = new byte[cipher.getOutputSize(ciphertext.length)];
    int written = cipher.processBytes(ciphertext, 0, ciphertext.length, output, 0);
    try {
      cipher.doFinal(output, written);
    } catch (InvalidCipherTextException e) {
      throw new InvalidMessageException(ErrorCode.DECRYPTION_FAILED, "authentication failed", e);
    }
    return output;
  }

  private static AEADBlockCipher newCipher(
      boolean forEncryption, byte[] key, byte[] nonce, byte[] associatedData) {
    if (key.length != KEY_SIZE) {
      throw new IllegalArgumentException("invalid key length: " + key.length);
    }
    if (nonce.length != NONCE_SIZE) {
      throw new IllegalArgumentException("invalid nonce length: " + nonce.length);
    }
    AEADBlockCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(
        forEncryption,
        new AEADParameters(new KeyParameter(key), TAG_SIZE * 8, nonce, associatedData));
    return cipher;
  }
}
