//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ecc;

import java.security.SecureRandom;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.foxwhisper.protocol.InvalidKeyException;

/** An X25519 private key. Used only for key agreement. */
public class ECPrivateKey {

  public static final int KEY_SIZE = X25519PrivateKeyParameters.KEY_SIZE;

  private final X25519PrivateKeyParameters privateKey;

  static ECPrivateKey generate(SecureRandom random) {
    return new ECPrivateKey(new X25519PrivateKeyParameters(random));
  }

  public ECPrivateKey(byte[] privateKey) throws InvalidKeyException {
    if (privateKey == null || privateKey.length != KEY_SIZE) {
      throw new InvalidKeyException("invalid X25519 private key length");
    }
    this.privateKey = new X25519PrivateKeyParameters(privateKey, 0);
  }

  private ECPrivateKey(X25519PrivateKeyParameters privateKey) {
    this.privateKey = privateKey;
  }

  public byte[] serialize() {
    return privateKey.getEncoded();
  }

  public ECPublicKey publicKey() {
    return new ECPublicKey(privateKey.generatePublicKey());
  }

  public byte[] calculateAgreement(ECPublicKey other) throws InvalidKeyException {
    X25519Agreement agreement = new X25519Agreement();
    agreement.init(privateKey);
    byte[] secret = new byte[agreement.getAgreementSize()];
    try {
      agreement.calculateAgreement(other.toParameters(), secret, 0);
    } catch (IllegalStateException e) {
      // Low-order points produce an all-zero shared secret.
      throw new InvalidKeyException("X25519 agreement failed", e);
    }
    return secret;
  }
}
