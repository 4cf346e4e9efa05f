//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ecc;

import org.foxwhisper.protocol.InvalidKeyException;

/**
 * An X25519 key pair used for handshake ephemerals and ratchet keys.
 *
 * <p>The public half is always derived from the private half, so a stored pair cannot be
 * inconsistent.
 */
public final class ECKeyPair {
  private final ECPublicKey publicKey;
  private final ECPrivateKey privateKey;

  private ECKeyPair(ECPrivateKey privateKey) {
    this.privateKey = privateKey;
    this.publicKey = privateKey.publicKey();
  }

  public static ECKeyPair fromPrivateKey(ECPrivateKey privateKey) {
    return new ECKeyPair(privateKey);
  }

  public ECPublicKey getPublicKey() {
    return publicKey;
  }

  public ECPrivateKey getPrivateKey() {
    return privateKey;
  }

  /**
   * @throws InvalidKeyException if {@code theirs} is null or a low-order point
   */
  public byte[] calculateAgreement(ECPublicKey theirs) throws InvalidKeyException {
    if (theirs == null) {
      throw new InvalidKeyException("public value is null");
    }
    return privateKey.calculateAgreement(theirs);
  }
}
