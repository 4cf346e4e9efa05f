//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

import java.nio.charset.StandardCharsets;
import org.foxwhisper.protocol.InvalidKeyException;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.ecc.ECPublicKey;
import org.foxwhisper.protocol.kdf.HKDF;
import org.foxwhisper.protocol.util.ByteUtil;

public class RootKey {

  private static final byte[] ROOT_INFO =
      "FoxWhisper-Ratchet-Root".getBytes(StandardCharsets.UTF_8);

  private final byte[] key;

  public RootKey(byte[] key) {
    if (key.length != 32) {
      throw new IllegalArgumentException("root key must be 32 bytes");
    }
    this.key = key.clone();
  }

  public byte[] getKeyBytes() {
    return key.clone();
  }

  /** Performs one Diffie-Hellman ratchet step, producing the next root key and a fresh chain. */
  public ChainStep createChain(ECPublicKey theirRatchetKey, ECKeyPair ourRatchetKey)
      throws InvalidKeyException {
    byte[] sharedSecret = ourRatchetKey.calculateAgreement(theirRatchetKey);
    byte[] derived = HKDF.deriveSecrets(sharedSecret, key, ROOT_INFO, 64);
    byte[][] parts = ByteUtil.split(derived, 32, 32);

    RootKey newRoot = new RootKey(parts[0]);
    ChainKey newChain = new ChainKey(parts[1], 0, ChainKey.SESSION_MESSAGE_KEY_INFO);

    ByteUtil.erase(sharedSecret);
    ByteUtil.erase(derived);
    ByteUtil.erase(parts[0]);
    ByteUtil.erase(parts[1]);
    return new ChainStep(newRoot, newChain);
  }
}
