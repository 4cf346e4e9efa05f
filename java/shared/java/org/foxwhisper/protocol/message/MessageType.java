//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

/** Closed set of wire message variants, each identified by its CBOR tag. */
public enum MessageType {
  HANDSHAKE_INIT(0xd1),
  HANDSHAKE_RESPONSE(0xd2),
  ENCRYPTED_MESSAGE(0xd4),
  GROUP_MESSAGE(0xd5),
  KEY_DISTRIBUTION(0xd6),
  EPOCH_RECORD(0xd7),
  MEDIA_FRAME(0xd8);

  private final int tag;

  MessageType(int tag) {
    this.tag = tag;
  }

  public int getTag() {
    return tag;
  }

  public static MessageType forTag(long tag) {
    for (MessageType type : values()) {
      if (type.tag == tag) {
        return type;
      }
    }
    return null;
  }
}
