//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kem;

/** The sender's half of a KEM: the shared secret and the ciphertext that conveys it. */
public class KEMEncapsulation {
  private final byte[] sharedSecret;
  private final byte[] ciphertext;

  KEMEncapsulation(byte[] sharedSecret, byte[] ciphertext) {
    this.sharedSecret = sharedSecret;
    this.ciphertext = ciphertext;
  }

  public byte[] getSharedSecret() {
    return sharedSecret;
  }

  public byte[] getCiphertext() {
    return ciphertext;
  }
}
