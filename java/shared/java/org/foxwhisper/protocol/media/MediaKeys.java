//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.media;

import java.nio.charset.StandardCharsets;
import org.foxwhisper.protocol.kdf.HKDF;
import org.foxwhisper.protocol.util.ByteUtil;

/** Derives per-call, per-epoch media frame keys from a participant's sender chain root. */
public final class MediaKeys {

  public static final int KEY_LENGTH = 32;

  private static final byte[] MEDIA_EPOCH_KEY_INFO =
      "FW-MediaEpochKey".getBytes(StandardCharsets.UTF_8);

  private MediaKeys() {}

  public static byte[] deriveEpochKey(byte[] senderRoot, String callId, long mediaEpoch) {
    if (senderRoot.length != KEY_LENGTH) {
      throw new IllegalArgumentException("sender root must be 32 bytes");
    }
    if (mediaEpoch < 0) {
      throw new IllegalArgumentException("negative media epoch");
    }
    return HKDF.deriveSecrets(
        senderRoot,
        callId.getBytes(StandardCharsets.UTF_8),
        ByteUtil.combine(MEDIA_EPOCH_KEY_INFO, ByteUtil.longToByteArray(mediaEpoch)),
        KEY_LENGTH);
  }
}
