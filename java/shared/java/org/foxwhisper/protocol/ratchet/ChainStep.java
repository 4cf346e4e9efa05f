//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

/** The output of one Diffie-Hellman ratchet step. */
public final class ChainStep {
  private final RootKey rootKey;
  private final ChainKey chainKey;

  ChainStep(RootKey rootKey, ChainKey chainKey) {
    this.rootKey = rootKey;
    this.chainKey = chainKey;
  }

  /** The root key that replaces the one the step started from. */
  public RootKey getRootKey() {
    return rootKey;
  }

  /** The new sending or receiving chain, starting at index 0. */
  public ChainKey getChainKey() {
    return chainKey;
  }
}
