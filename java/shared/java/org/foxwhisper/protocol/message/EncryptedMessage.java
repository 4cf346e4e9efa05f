//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.crypto.Aes256Gcm;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.ecc.ECPublicKey;

/** A pairwise ratchet message. */
public final class EncryptedMessage extends ProtocolMessage {

  public static final int SESSION_ID_LENGTH = 16;
  public static final int MESSAGE_ID_LENGTH = 16;

  private final byte[] sessionId;
  private final byte[] messageId;
  private final DeviceAddress sender;
  private final DeviceAddress recipient;
  private final long timestamp;
  private final byte[] ratchetKey;
  private final int index;
  private final int previousChainLength;
  private final byte[] iv;
  private final byte[] ciphertext;
  private final byte[] tag;

  public EncryptedMessage(
      byte[] sessionId,
      byte[] messageId,
      DeviceAddress sender,
      DeviceAddress recipient,
      long timestamp,
      byte[] ratchetKey,
      int index,
      int previousChainLength,
      byte[] iv,
      byte[] ciphertext,
      byte[] tag) {
    this.sessionId = sessionId.clone();
    this.messageId = messageId.clone();
    this.sender = sender;
    this.recipient = recipient;
    this.timestamp = timestamp;
    this.ratchetKey = ratchetKey.clone();
    this.index = index;
    this.previousChainLength = previousChainLength;
    this.iv = iv.clone();
    this.ciphertext = ciphertext.clone();
    this.tag = tag.clone();
  }

  public static EncryptedMessage deserialize(byte[] serialized) throws InvalidMessageException {
    try {
      return decodeAs(serialized, EncryptedMessage.class);
    } catch (InvalidVersionException e) {
      throw new InvalidMessageException(e.getCode(), e.getMessage(), e);
    }
  }

  static EncryptedMessage fromFields(CborMap fields) throws CborException, InvalidMessageException {
    fields.requireOnly(
        "version",
        "session_id",
        "message_id",
        "sender",
        "recipient",
        "timestamp",
        "dh",
        "index",
        "pn",
        "iv",
        "ciphertext",
        "tag");
    int index = fields.getInt("index");
    int previousChainLength = fields.getInt("pn");
    if (index < 0 || previousChainLength < 0) {
      throw new CborException("negative counter");
    }
    return new EncryptedMessage(
        fields.getBytes("session_id", SESSION_ID_LENGTH),
        fields.getBytes("message_id", MESSAGE_ID_LENGTH),
        DeviceAddress.parse(fields.getString("sender")),
        DeviceAddress.parse(fields.getString("recipient")),
        fields.getLong("timestamp"),
        fields.getBytes("dh", ECPublicKey.KEY_SIZE),
        index,
        previousChainLength,
        fields.getBytes("iv", Aes256Gcm.NONCE_SIZE),
        fields.getBytes("ciphertext"),
        fields.getBytes("tag", Aes256Gcm.TAG_SIZE));
  }

  @Override
  public MessageType getType() {
    return MessageType.ENCRYPTED_MESSAGE;
  }

  /** SHA-256 over the canonical header, bound to the ciphertext as AEAD associated data. */
  public byte[] getAssociatedData() {
    return associatedData(
        sessionId, messageId, sender, recipient, timestamp, ratchetKey, index, previousChainLength);
  }

  public static byte[] associatedData(
      byte[] sessionId,
      byte[] messageId,
      DeviceAddress sender,
      DeviceAddress recipient,
      long timestamp,
      byte[] ratchetKey,
      int index,
      int previousChainLength) {
    Map<String, Object> header = newFieldMap();
    header.put("type", "encrypted-message");
    header.put("session_id", sessionId);
    header.put("message_id", messageId);
    header.put("sender", sender.toString());
    header.put("recipient", recipient.toString());
    header.put("timestamp", timestamp);
    header.put("dh", ratchetKey);
    header.put("index", index);
    header.put("pn", previousChainLength);
    return Hashes.sha256(CanonicalCbor.encode(header));
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("session_id", sessionId);
    fields.put("message_id", messageId);
    fields.put("sender", sender.toString());
    fields.put("recipient", recipient.toString());
    fields.put("timestamp", timestamp);
    fields.put("dh", ratchetKey);
    fields.put("index", index);
    fields.put("pn", previousChainLength);
    fields.put("iv", iv);
    fields.put("ciphertext", ciphertext);
    fields.put("tag", tag);
    return fields;
  }

  public byte[] getSessionId() {
    return sessionId.clone();
  }

  public byte[] getMessageId() {
    return messageId.clone();
  }

  public DeviceAddress getSender() {
    return sender;
  }

  public DeviceAddress getRecipient() {
    return recipient;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public byte[] getRatchetKey() {
    return ratchetKey.clone();
  }

  public int getIndex() {
    return index;
  }

  public int getPreviousChainLength() {
    return previousChainLength;
  }

  public byte[] getIv() {
    return iv.clone();
  }

  public byte[] getCiphertext() {
    return ciphertext.clone();
  }

  public byte[] getTag() {
    return tag.clone();
  }
}
