//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

public class MessageKeys {
  private final byte[] cipherKey;
  private final int counter;

  public MessageKeys(byte[] cipherKey, int counter) {
    this.cipherKey = cipherKey;
    this.counter = counter;
  }

  public byte[] getCipherKey() {
    return cipherKey;
  }

  public int getCounter() {
    return counter;
  }
}
