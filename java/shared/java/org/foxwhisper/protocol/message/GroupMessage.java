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

/** A message encrypted under a sender's chain for one group epoch. */
public final class GroupMessage extends ProtocolMessage {

  private final String groupId;
  private final long epoch;
  private final DeviceAddress sender;
  private final int index;
  private final long timestamp;
  private final byte[] iv;
  private final byte[] ciphertext;
  private final byte[] tag;

  public GroupMessage(
      String groupId,
      long epoch,
      DeviceAddress sender,
      int index,
      long timestamp,
      byte[] iv,
      byte[] ciphertext,
      byte[] tag) {
    this.groupId = groupId;
    this.epoch = epoch;
    this.sender = sender;
    this.index = index;
    this.timestamp = timestamp;
    this.iv = iv.clone();
    this.ciphertext = ciphertext.clone();
    this.tag = tag.clone();
  }

  public static GroupMessage deserialize(byte[] serialized) throws InvalidMessageException {
    try {
      return decodeAs(serialized, GroupMessage.class);
    } catch (InvalidVersionException e) {
      throw new InvalidMessageException(e.getCode(), e.getMessage(), e);
    }
  }

  static GroupMessage fromFields(CborMap fields) throws CborException, InvalidMessageException {
    fields.requireOnly(
        "version", "group_id", "epoch", "sender", "index", "timestamp", "iv", "ciphertext", "tag");
    int index = fields.getInt("index");
    long epoch = fields.getLong("epoch");
    if (index < 0 || epoch < 0) {
      throw new CborException("negative counter");
    }
    return new GroupMessage(
        fields.getString("group_id"),
        epoch,
        DeviceAddress.parse(fields.getString("sender")),
        index,
        fields.getLong("timestamp"),
        fields.getBytes("iv", Aes256Gcm.NONCE_SIZE),
        fields.getBytes("ciphertext"),
        fields.getBytes("tag", Aes256Gcm.TAG_SIZE));
  }

  @Override
  public MessageType getType() {
    return MessageType.GROUP_MESSAGE;
  }

  public byte[] getAssociatedData() {
    return associatedData(groupId, epoch, sender, index, timestamp);
  }

  public static byte[] associatedData(
      String groupId, long epoch, DeviceAddress sender, int index, long timestamp) {
    Map<String, Object> header = newFieldMap();
    header.put("type", "group-message");
    header.put("group_id", groupId);
    header.put("epoch", epoch);
    header.put("sender", sender.toString());
    header.put("index", index);
    header.put("timestamp", timestamp);
    return Hashes.sha256(CanonicalCbor.encode(header));
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("group_id", groupId);
    fields.put("epoch", epoch);
    fields.put("sender", sender.toString());
    fields.put("index", index);
    fields.put("timestamp", timestamp);
    fields.put("iv", iv);
    fields.put("ciphertext", ciphertext);
    fields.put("tag", tag);
    return fields;
  }

  public String getGroupId() {
    return groupId;
  }

  public long getEpoch() {
    return epoch;
  }

  public DeviceAddress getSender() {
    return sender;
  }

  public int getIndex() {
    return index;
  }

  public long getTimestamp() {
    return timestamp;
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
