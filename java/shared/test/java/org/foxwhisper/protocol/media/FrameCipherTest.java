//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.media;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.message.MediaFrameHeader;
import org.junit.Test;

public class FrameCipherTest {
  private static final byte[] ROOT = new byte[MediaKeys.KEY_LENGTH];
  private static final byte[] PAYLOAD = "opus frame".getBytes(StandardCharsets.UTF_8);

  static {
    Arrays.fill(ROOT, (byte) 0x42);
  }

  private static MediaFrameHeader header(long sequence, String layer) {
    return new MediaFrameHeader("call-1", "alice", "audio-0", sequence, 3, layer);
  }

  @Test
  public void sealedFrameOpensUnderSameHeader() throws Exception {
    byte[] key = MediaKeys.deriveEpochKey(ROOT, "call-1", 3);
    byte[] sealed = FrameCipher.seal(key, header(10, "high"), PAYLOAD);

    assertEquals(PAYLOAD.length + 16, sealed.length);
    assertArrayEquals(PAYLOAD, FrameCipher.open(key, header(10, "high"), sealed));
  }

  @Test
  public void alteredHeaderFailsAuthentication() {
    byte[] key = MediaKeys.deriveEpochKey(ROOT, "call-1", 3);
    byte[] sealed = FrameCipher.seal(key, header(10, "high"), PAYLOAD);

    InvalidMessageException e =
        assertThrows(
            InvalidMessageException.class, () -> FrameCipher.open(key, header(11, "high"), sealed));
    assertEquals(ErrorCode.DECRYPTION_FAILED, e.getCode());
    assertThrows(
        InvalidMessageException.class, () -> FrameCipher.open(key, header(10, "low"), sealed));
    assertThrows(
        InvalidMessageException.class, () -> FrameCipher.open(key, header(10, null), sealed));
  }

  @Test
  public void alteredPayloadFailsAuthentication() {
    byte[] key = MediaKeys.deriveEpochKey(ROOT, "call-1", 3);
    byte[] sealed = FrameCipher.seal(key, header(10, null), PAYLOAD);
    sealed[2] ^= 0x20;

    assertThrows(
        InvalidMessageException.class, () -> FrameCipher.open(key, header(10, null), sealed));
  }

  @Test
  public void epochKeysAreSeparated() {
    byte[] epochThree = MediaKeys.deriveEpochKey(ROOT, "call-1", 3);
    byte[] epochFour = MediaKeys.deriveEpochKey(ROOT, "call-1", 4);
    byte[] otherCall = MediaKeys.deriveEpochKey(ROOT, "call-2", 3);

    assertEquals(MediaKeys.KEY_LENGTH, epochThree.length);
    assertFalse(Arrays.equals(epochThree, epochFour));
    assertFalse(Arrays.equals(epochThree, otherCall));
    assertArrayEquals(epochThree, MediaKeys.deriveEpochKey(ROOT, "call-1", 3));

    byte[] sealed = FrameCipher.seal(epochThree, header(1, null), PAYLOAD);
    assertThrows(
        InvalidMessageException.class, () -> FrameCipher.open(epochFour, header(1, null), sealed));
  }

  @Test
  public void rejectsBadRootsAndEpochs() {
    assertThrows(
        IllegalArgumentException.class, () -> MediaKeys.deriveEpochKey(new byte[16], "call", 0));
    assertThrows(IllegalArgumentException.class, () -> MediaKeys.deriveEpochKey(ROOT, "call", -1));
  }
}
