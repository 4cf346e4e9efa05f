//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

import java.util.Objects;
import org.foxwhisper.protocol.ecc.ECPublicKey;

/** Identifies a skipped session message key by the sender's ratchet key and chain index. */
public final class SkippedKeyId {
  private final ECPublicKey ratchetKey;
  private final int index;

  public SkippedKeyId(ECPublicKey ratchetKey, int index) {
    this.ratchetKey = Objects.requireNonNull(ratchetKey);
    this.index = index;
  }

  public ECPublicKey getRatchetKey() {
    return ratchetKey;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SkippedKeyId)) return false;
    SkippedKeyId that = (SkippedKeyId) other;
    return index == that.index && ratchetKey.equals(that.ratchetKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ratchetKey, index);
  }

  @Override
  public String toString() {
    return ratchetKey + "#" + index;
  }
}
