//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.LinkedHashMap;
import java.util.Map;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.cbor.CborTag;

/**
 * Base of the tagged union of wire messages. Every variant serializes to a CBOR tag (see {@link
 * MessageType}) wrapping a canonical map, and rejects unknown fields when decoded.
 */
public abstract class ProtocolMessage {

  public static final int CURRENT_VERSION = 1;

  public abstract MessageType getType();

  /** The full field map, including any signatures. */
  protected abstract Map<String, Object> toFields();

  public byte[] serialize() {
    return CanonicalCbor.encode(new CborTag(getType().getTag(), toFields()));
  }

  /**
   * Decodes any message variant.
   *
   * @throws InvalidVersionException if the message carries a version other than {@link
   *     #CURRENT_VERSION}
   * @throws InvalidMessageException if the input is not a well-formed message
   */
  public static ProtocolMessage decode(byte[] serialized)
      throws InvalidMessageException, InvalidVersionException {
    final Object decoded;
    try {
      decoded = CanonicalCbor.decode(serialized);
    } catch (CborException e) {
      throw new InvalidMessageException("malformed message encoding", e);
    }
    if (!(decoded instanceof CborTag)) {
      throw new InvalidMessageException("message is not tagged");
    }

    CborTag tagged = (CborTag) decoded;
    MessageType type = MessageType.forTag(tagged.getTag());
    if (type == null) {
      throw new InvalidMessageException("unknown message tag " + tagged.getTag());
    }

    try {
      CborMap fields = CborMap.of(tagged.getContent());
      long version = fields.getLong("version");
      if (version != CURRENT_VERSION) {
        throw new InvalidVersionException("unsupported message version " + version);
      }

      switch (type) {
        case HANDSHAKE_INIT:
          return HandshakeInitMessage.fromFields(fields);
        case HANDSHAKE_RESPONSE:
          return HandshakeResponseMessage.fromFields(fields);
        case ENCRYPTED_MESSAGE:
          return EncryptedMessage.fromFields(fields);
        case GROUP_MESSAGE:
          return GroupMessage.fromFields(fields);
        case KEY_DISTRIBUTION:
          return SenderKeyDistributionMessage.fromFields(fields);
        case EPOCH_RECORD:
          return EpochAuthenticityRecord.fromFields(fields);
        case MEDIA_FRAME:
          return MediaFrameHeader.fromFields(fields);
        default:
          throw new AssertionError("unhandled message type " + type);
      }
    } catch (CborException e) {
      ErrorCode code =
          type == MessageType.EPOCH_RECORD ? ErrorCode.TRUNCATED_EARE : ErrorCode.DECODE_FAILED;
      throw new InvalidMessageException(code, "malformed " + type + ": " + e.getMessage(), e);
    }
  }

  /** Decodes a message that must be of the given variant. */
  public static <T extends ProtocolMessage> T decodeAs(byte[] serialized, Class<T> variant)
      throws InvalidMessageException, InvalidVersionException {
    ProtocolMessage message = decode(serialized);
    if (!variant.isInstance(message)) {
      throw new InvalidMessageException(
          "expected " + variant.getSimpleName() + " but got " + message.getType());
    }
    return variant.cast(message);
  }

  protected static Map<String, Object> newFieldMap() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("version", CURRENT_VERSION);
    return fields;
  }
}
