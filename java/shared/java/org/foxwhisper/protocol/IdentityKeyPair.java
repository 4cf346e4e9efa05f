//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.security.SecureRandom;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/** Holder for an Ed25519 signing key and its {@link IdentityKey}. */
public class IdentityKeyPair {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final IdentityKey publicKey;
  private final Ed25519PrivateKeyParameters privateKey;

  private IdentityKeyPair(Ed25519PrivateKeyParameters privateKey) {
    this.privateKey = privateKey;
    try {
      this.publicKey = new IdentityKey(privateKey.generatePublicKey().getEncoded());
    } catch (InvalidKeyException e) {
      throw new AssertionError(e);
    }
  }

  public static IdentityKeyPair generate() {
    return new IdentityKeyPair(new Ed25519PrivateKeyParameters(SECURE_RANDOM));
  }

  public IdentityKey getPublicKey() {
    return publicKey;
  }

  public byte[] signMessage(byte[] message) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }
}
