//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups.state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.ratchet.ChainKey;
import org.foxwhisper.protocol.ratchet.SkippedKeyCache;

/**
 * The sender key chain of one device for one group epoch.
 *
 * <p>The chain root is fixed for the lifetime of the record; the chain key advances as messages are
 * sent or received. Keys for indices passed over on receipt are kept in a bounded cache.
 */
public class SenderKeyRecord {

  private final String groupId;
  private final long epoch;
  private final byte[] epochRecordHash;
  private final DeviceAddress sender;
  private final byte[] chainRoot;
  private ChainKey chainKey;
  private final SkippedKeyCache<Integer> skippedKeys;

  public SenderKeyRecord(
      String groupId,
      long epoch,
      byte[] epochRecordHash,
      DeviceAddress sender,
      byte[] chainRoot,
      int maxSkippedKeys) {
    this.groupId = groupId;
    this.epoch = epoch;
    this.epochRecordHash = epochRecordHash.clone();
    this.sender = sender;
    this.chainRoot = chainRoot.clone();
    this.chainKey = new ChainKey(chainRoot, 0, ChainKey.GROUP_MESSAGE_KEY_INFO);
    this.skippedKeys = new SkippedKeyCache<>(maxSkippedKeys);
  }

  public SenderKeyRecord(byte[] serialized) throws InvalidMessageException {
    try {
      CborMap fields = CborMap.of(CanonicalCbor.decode(serialized));
      this.groupId = fields.getString("group_id");
      this.epoch = fields.getLong("epoch");
      this.epochRecordHash = fields.getBytes("epoch_record_hash");
      this.sender = DeviceAddress.parse(fields.getString("sender"));
      this.chainRoot = fields.getBytes("chain_root");
      this.chainKey =
          new ChainKey(
              fields.getBytes("chain_key"),
              fields.getInt("index"),
              ChainKey.GROUP_MESSAGE_KEY_INFO);
      this.skippedKeys = new SkippedKeyCache<>(fields.getInt("max_skipped_keys"));
      for (Object entry : fields.getList("skipped_keys")) {
        CborMap skipped = CborMap.of(entry);
        skippedKeys.put(skipped.getInt("index"), skipped.getBytes("key"));
      }
    } catch (CborException | IllegalArgumentException e) {
      throw new InvalidMessageException("corrupt sender key record", e);
    }
  }

  public byte[] serialize() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("group_id", groupId);
    fields.put("epoch", epoch);
    fields.put("epoch_record_hash", epochRecordHash);
    fields.put("sender", sender.toString());
    fields.put("chain_root", chainRoot);
    fields.put("chain_key", chainKey.getKey());
    fields.put("index", chainKey.getIndex());
    fields.put("max_skipped_keys", skippedKeys.capacity());

    List<Object> skipped = new ArrayList<>();
    for (Map.Entry<Integer, byte[]> entry : skippedKeys.entries()) {
      Map<String, Object> encoded = new LinkedHashMap<>();
      encoded.put("index", entry.getKey());
      encoded.put("key", entry.getValue());
      skipped.add(encoded);
    }
    fields.put("skipped_keys", skipped);
    return CanonicalCbor.encode(fields);
  }

  public String getGroupId() {
    return groupId;
  }

  public long getEpoch() {
    return epoch;
  }

  /** Hash of the epoch record this chain was distributed under. */
  public byte[] getEpochRecordHash() {
    return epochRecordHash.clone();
  }

  public DeviceAddress getSender() {
    return sender;
  }

  public byte[] getChainRoot() {
    return chainRoot.clone();
  }

  public boolean hasSameRoot(byte[] otherRoot) {
    return Arrays.equals(chainRoot, otherRoot);
  }

  public ChainKey getChainKey() {
    return chainKey;
  }

  public void setChainKey(ChainKey chainKey) {
    if (this.chainKey != chainKey) {
      this.chainKey.erase();
    }
    this.chainKey = chainKey;
  }

  public SkippedKeyCache<Integer> getSkippedKeys() {
    return skippedKeys;
  }
}
