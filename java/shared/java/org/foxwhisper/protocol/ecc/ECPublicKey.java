//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ecc;

import java.util.Arrays;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.foxwhisper.protocol.InvalidKeyException;
import org.foxwhisper.protocol.util.ByteUtil;

/** An X25519 public key. */
public class ECPublicKey implements Comparable<ECPublicKey> {

  public static final int KEY_SIZE = X25519PublicKeyParameters.KEY_SIZE;

  private final byte[] publicKey;

  public ECPublicKey(byte[] serialized) throws InvalidKeyException {
    if (serialized == null || serialized.length != KEY_SIZE) {
      throw new InvalidKeyException(
          "invalid X25519 public key length: " + (serialized == null ? 0 : serialized.length));
    }
    this.publicKey = serialized.clone();
  }

  ECPublicKey(X25519PublicKeyParameters parameters) {
    this.publicKey = parameters.getEncoded();
  }

  public byte[] serialize() {
    return publicKey.clone();
  }

  X25519PublicKeyParameters toParameters() {
    return new X25519PublicKeyParameters(publicKey, 0);
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof ECPublicKey)) return false;
    return Arrays.equals(publicKey, ((ECPublicKey) other).publicKey);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(publicKey);
  }

  @Override
  public int compareTo(ECPublicKey another) {
    return ByteUtil.compareUnsigned(publicKey, another.publicKey);
  }
}
