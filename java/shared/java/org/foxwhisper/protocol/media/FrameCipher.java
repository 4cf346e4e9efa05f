//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.media;

import java.nio.charset.StandardCharsets;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.crypto.Aes256Gcm;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.message.MediaFrameHeader;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * Seals media frame payloads under a media epoch key.
 *
 * <p>The associated data is the header digest, so a router that alters any header field breaks
 * authentication. The IV is derived from the header, which is unique per key as long as frame
 * sequences never repeat within a stream and epoch.
 */
public final class FrameCipher {

  private static final byte[] IV_LABEL = "FW-FrameIV".getBytes(StandardCharsets.UTF_8);

  private FrameCipher() {}

  /** Returns the ciphertext with the authentication tag appended. */
  public static byte[] seal(byte[] epochKey, MediaFrameHeader header, byte[] payload) {
    byte[] digest = header.getDigest();
    return Aes256Gcm.encrypt(epochKey, ivFor(digest), payload, digest);
  }

  /**
   * @throws InvalidMessageException if the frame or its header has been modified, or the key is
   *     wrong
   */
  public static byte[] open(byte[] epochKey, MediaFrameHeader header, byte[] sealed)
      throws InvalidMessageException {
    byte[] digest = header.getDigest();
    return Aes256Gcm.decrypt(epochKey, ivFor(digest), sealed, digest);
  }

  private static byte[] ivFor(byte[] headerDigest) {
    return ByteUtil.trim(Hashes.sha256(IV_LABEL, headerDigest), Aes256Gcm.NONCE_SIZE);
  }
}
