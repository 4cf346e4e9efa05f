//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kem;

import org.bouncycastle.pqc.crypto.crystals.kyber.KyberParameters;

public enum KEMKeyType {
  KYBER_1024(KyberParameters.kyber1024, 1568, 1568, 32);

  private final KyberParameters parameters;
  private final int publicKeyLength;
  private final int ciphertextLength;
  private final int sharedSecretLength;

  KEMKeyType(
      KyberParameters parameters,
      int publicKeyLength,
      int ciphertextLength,
      int sharedSecretLength) {
    this.parameters = parameters;
    this.publicKeyLength = publicKeyLength;
    this.ciphertextLength = ciphertextLength;
    this.sharedSecretLength = sharedSecretLength;
  }

  KyberParameters getParameters() {
    return parameters;
  }

  public int getPublicKeyLength() {
    return publicKeyLength;
  }

  public int getCiphertextLength() {
    return ciphertextLength;
  }

  public int getSharedSecretLength() {
    return sharedSecretLength;
  }
}
