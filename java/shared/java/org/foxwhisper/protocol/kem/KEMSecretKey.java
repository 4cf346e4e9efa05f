//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kem;

import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKEMExtractor;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPrivateKeyParameters;
import org.foxwhisper.protocol.InvalidKeyException;

public class KEMSecretKey {
  private final KEMKeyType keyType;
  private final KyberPrivateKeyParameters privateKey;

  KEMSecretKey(KEMKeyType keyType, KyberPrivateKeyParameters privateKey) {
    this.keyType = keyType;
    this.privateKey = privateKey;
  }

  public KEMKeyType getKeyType() {
    return keyType;
  }

  public byte[] decapsulate(byte[] ciphertext) throws InvalidKeyException {
    if (ciphertext == null || ciphertext.length != keyType.getCiphertextLength()) {
      throw new InvalidKeyException("invalid " + keyType + " ciphertext length");
    }
    return new KyberKEMExtractor(privateKey).extractSecret(ciphertext);
  }
}
