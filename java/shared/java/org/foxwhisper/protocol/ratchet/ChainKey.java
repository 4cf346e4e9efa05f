//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

import java.nio.charset.StandardCharsets;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.kdf.HKDF;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * One step of a symmetric ratchet. A chain key at index {@code n} yields the message key for
 * {@code n} and the chain key for {@code n + 1}; it cannot be used to recover earlier keys.
 */
public class ChainKey {

  public static final byte[] SESSION_MESSAGE_KEY_INFO =
      "FoxWhisper-Ratchet-MessageKey".getBytes(StandardCharsets.UTF_8);
  public static final byte[] GROUP_MESSAGE_KEY_INFO =
      "FoxWhisper-Group-MessageKey".getBytes(StandardCharsets.UTF_8);

  private static final byte[] CHAIN_KEY_SEED = {0x02};

  private final byte[] key;
  private final int index;
  private final byte[] messageKeyInfo;

  public ChainKey(byte[] key, int index, byte[] messageKeyInfo) {
    if (key.length != 32) {
      throw new IllegalArgumentException("chain key must be 32 bytes");
    }
    if (index < 0) {
      throw new IllegalArgumentException("negative chain index");
    }
    this.key = key.clone();
    this.index = index;
    this.messageKeyInfo = messageKeyInfo;
  }

  public byte[] getKey() {
    return key.clone();
  }

  public int getIndex() {
    return index;
  }

  public ChainKey getNextChainKey() {
    byte[] nextKey = Hashes.hmacSha256(key, CHAIN_KEY_SEED);
    ChainKey next = new ChainKey(nextKey, index + 1, messageKeyInfo);
    ByteUtil.erase(nextKey);
    return next;
  }

  public MessageKeys getMessageKeys() {
    byte[] cipherKey = HKDF.deriveSecrets(key, ByteUtil.intToByteArray(index), messageKeyInfo, 32);
    return new MessageKeys(cipherKey, index);
  }

  /** Zeroes this chain key. The instance must not be used afterwards. */
  public void erase() {
    ByteUtil.erase(key);
  }
}
