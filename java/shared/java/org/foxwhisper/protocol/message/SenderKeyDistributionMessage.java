//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.Arrays;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.crypto.Hashes;

/**
 * Hands a sender's chain root for one epoch to one member. Only ever sent inside an {@link
 * EncryptedMessage}; the enclosing session authenticates the sender.
 *
 * <p>A sender that has resolved a fork names the resolution its key was issued under: the epoch of
 * the fork and the hash of the winning record. Keys issued before the sender's latest resolution
 * carry an older one, or none.
 */
public final class SenderKeyDistributionMessage extends ProtocolMessage {

  public static final int CHAIN_ROOT_LENGTH = 32;

  private final String groupId;
  private final long epoch;
  private final byte[] epochRecordHash;
  private final DeviceAddress sender;
  private final byte[] chainRoot;
  private final long resetEpoch;
  private final byte[] resetWinner;

  public SenderKeyDistributionMessage(
      String groupId, long epoch, byte[] epochRecordHash, DeviceAddress sender, byte[] chainRoot) {
    this(groupId, epoch, epochRecordHash, sender, chainRoot, 0, null);
  }

  /**
   * @param resetWinner hash of the winning record of the sender's latest fork resolution, or
   *     {@code null} if it has never resolved one
   */
  public SenderKeyDistributionMessage(
      String groupId,
      long epoch,
      byte[] epochRecordHash,
      DeviceAddress sender,
      byte[] chainRoot,
      long resetEpoch,
      byte[] resetWinner) {
    if (resetWinner != null && resetEpoch < 1) {
      throw new IllegalArgumentException("fork resolutions start at epoch 1");
    }
    this.groupId = groupId;
    this.epoch = epoch;
    this.epochRecordHash = epochRecordHash.clone();
    this.sender = sender;
    this.chainRoot = chainRoot.clone();
    this.resetEpoch = resetWinner == null ? 0 : resetEpoch;
    this.resetWinner = resetWinner == null ? null : resetWinner.clone();
  }

  public static SenderKeyDistributionMessage deserialize(byte[] serialized)
      throws InvalidMessageException {
    try {
      return decodeAs(serialized, SenderKeyDistributionMessage.class);
    } catch (InvalidVersionException e) {
      throw new InvalidMessageException(e.getCode(), e.getMessage(), e);
    }
  }

  static SenderKeyDistributionMessage fromFields(CborMap fields)
      throws CborException, InvalidMessageException {
    fields.requireOnly(
        "version",
        "group_id",
        "epoch",
        "eare_hash",
        "sender",
        "chain_root",
        "reset_epoch",
        "reset_winner");
    if (fields.has("reset_epoch") != fields.has("reset_winner")) {
      throw new CborException("reset_epoch and reset_winner must appear together");
    }
    boolean reset = fields.has("reset_winner");
    try {
      return new SenderKeyDistributionMessage(
          fields.getString("group_id"),
          fields.getLong("epoch"),
          fields.getBytes("eare_hash", Hashes.SHA256_LENGTH),
          DeviceAddress.parse(fields.getString("sender")),
          fields.getBytes("chain_root", CHAIN_ROOT_LENGTH),
          reset ? fields.getLong("reset_epoch") : 0,
          reset ? fields.getBytes("reset_winner", Hashes.SHA256_LENGTH) : null);
    } catch (IllegalArgumentException e) {
      throw new CborException(e.getMessage(), e);
    }
  }

  @Override
  public MessageType getType() {
    return MessageType.KEY_DISTRIBUTION;
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("group_id", groupId);
    fields.put("epoch", epoch);
    fields.put("eare_hash", epochRecordHash);
    fields.put("sender", sender.toString());
    fields.put("chain_root", chainRoot);
    if (resetWinner != null) {
      fields.put("reset_epoch", resetEpoch);
      fields.put("reset_winner", resetWinner);
    }
    return fields;
  }

  public String getGroupId() {
    return groupId;
  }

  public long getEpoch() {
    return epoch;
  }

  public byte[] getEpochRecordHash() {
    return epochRecordHash.clone();
  }

  public DeviceAddress getSender() {
    return sender;
  }

  public byte[] getChainRoot() {
    return chainRoot.clone();
  }

  /** Epoch of the fork the sender last resolved, or 0 if it has never resolved one. */
  public long getResetEpoch() {
    return resetEpoch;
  }

  /** Hash of the record that won the sender's last fork resolution, or {@code null}. */
  public byte[] getResetWinner() {
    return resetWinner == null ? null : resetWinner.clone();
  }

  public boolean hasSameRoot(byte[] otherRoot) {
    return Arrays.equals(chainRoot, otherRoot);
  }
}
