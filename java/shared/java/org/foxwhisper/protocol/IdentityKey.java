//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.util.Arrays;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.foxwhisper.protocol.util.Hex;

/**
 * An Ed25519 verification key. Used for identities and for per-device signing keys; never used
 * for encryption.
 */
public class IdentityKey {

  public static final int KEY_SIZE = Ed25519PublicKeyParameters.KEY_SIZE;
  public static final int SIGNATURE_SIZE = Ed25519PublicKeyParameters.KEY_SIZE * 2;

  private final byte[] publicKey;

  public IdentityKey(byte[] bytes) throws InvalidKeyException {
    if (bytes == null || bytes.length != KEY_SIZE) {
      throw new InvalidKeyException("invalid Ed25519 public key length");
    }
    this.publicKey = bytes.clone();
  }

  public byte[] serialize() {
    return publicKey.clone();
  }

  public boolean verifySignature(byte[] message, byte[] signature) {
    if (signature == null || signature.length != SIGNATURE_SIZE) {
      return false;
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature);
  }

  public String getFingerprint() {
    return Hex.toStringCondensed(publicKey);
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof IdentityKey)) return false;

    return Arrays.equals(publicKey, ((IdentityKey) other).publicKey);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(publicKey);
  }
}
