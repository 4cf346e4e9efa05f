//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.util.Hex;

/**
 * Epoch Authenticity Record (EARE): the signed attestation of one group epoch's membership.
 *
 * <p>Each record commits to its predecessor through {@link #getPreviousHash()}, forming a hash
 * chain. The record hash covers every field except the signatures, so adding countersignatures
 * never changes it. Members and admins are kept sorted and duplicate-free.
 */
public final class EpochAuthenticityRecord extends ProtocolMessage {

  /** Previous hash of the first epoch of a group. */
  public static final byte[] GENESIS_PREVIOUS_HASH = new byte[Hashes.SHA256_LENGTH];

  private final String groupId;
  private final long epoch;
  private final byte[] previousHash;
  private final SortedSet<DeviceAddress> members;
  private final SortedSet<DeviceAddress> admins;
  private final DeviceAddress issuedBy;
  private final long timestamp;
  private final Map<DeviceAddress, byte[]> signatures;

  public EpochAuthenticityRecord(
      String groupId,
      long epoch,
      byte[] previousHash,
      Collection<DeviceAddress> members,
      Collection<DeviceAddress> admins,
      DeviceAddress issuedBy,
      long timestamp,
      Map<DeviceAddress, byte[]> signatures) {
    if (epoch < 0) {
      throw new IllegalArgumentException("negative epoch");
    }
    if (previousHash.length != Hashes.SHA256_LENGTH) {
      throw new IllegalArgumentException("previous hash must be 32 bytes");
    }
    this.groupId = groupId;
    this.epoch = epoch;
    this.previousHash = previousHash.clone();
    this.members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    this.admins = Collections.unmodifiableSortedSet(new TreeSet<>(admins));
    this.issuedBy = issuedBy;
    this.timestamp = timestamp;
    TreeMap<DeviceAddress, byte[]> copy = new TreeMap<>();
    for (Map.Entry<DeviceAddress, byte[]> entry : signatures.entrySet()) {
      copy.put(entry.getKey(), entry.getValue().clone());
    }
    this.signatures = Collections.unmodifiableMap(copy);
  }

  public static EpochAuthenticityRecord deserialize(byte[] serialized)
      throws InvalidMessageException {
    try {
      return decodeAs(serialized, EpochAuthenticityRecord.class);
    } catch (InvalidVersionException e) {
      throw new InvalidMessageException(e.getCode(), e.getMessage(), e);
    }
  }

  static EpochAuthenticityRecord fromFields(CborMap fields)
      throws CborException, InvalidMessageException {
    fields.requireOnly(
        "version",
        "group_id",
        "epoch",
        "previous_hash",
        "members",
        "admins",
        "issued_by",
        "timestamp",
        "signatures");
    long epoch = fields.getLong("epoch");
    if (epoch < 0) {
      throw new CborException("negative epoch");
    }

    List<DeviceAddress> members = parseSortedAddresses(fields.getStringList("members"));
    List<DeviceAddress> admins = parseSortedAddresses(fields.getStringList("admins"));

    Map<DeviceAddress, byte[]> signatures = new LinkedHashMap<>();
    DeviceAddress previousSigner = null;
    for (Object entry : fields.getList("signatures")) {
      CborMap signature = CborMap.of(entry).requireOnly("signer", "signature");
      DeviceAddress signer = DeviceAddress.parse(signature.getString("signer"));
      if (previousSigner != null && previousSigner.compareTo(signer) >= 0) {
        throw new CborException("signatures must be sorted by signer without duplicates");
      }
      signatures.put(signer, signature.getBytes("signature"));
      previousSigner = signer;
    }

    return new EpochAuthenticityRecord(
        fields.getString("group_id"),
        epoch,
        fields.getBytes("previous_hash", Hashes.SHA256_LENGTH),
        members,
        admins,
        DeviceAddress.parse(fields.getString("issued_by")),
        fields.getLong("timestamp"),
        signatures);
  }

  private static List<DeviceAddress> parseSortedAddresses(List<String> encoded)
      throws CborException, InvalidMessageException {
    List<DeviceAddress> result = new ArrayList<>(encoded.size());
    for (String value : encoded) {
      DeviceAddress address = DeviceAddress.parse(value);
      if (!result.isEmpty() && result.get(result.size() - 1).compareTo(address) >= 0) {
        throw new CborException("addresses must be sorted without duplicates");
      }
      result.add(address);
    }
    return result;
  }

  @Override
  public MessageType getType() {
    return MessageType.EPOCH_RECORD;
  }

  /** Everything except the signatures. */
  public Map<String, Object> getSignedFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("group_id", groupId);
    fields.put("epoch", epoch);
    fields.put("previous_hash", previousHash);
    fields.put("members", addressStrings(members));
    fields.put("admins", addressStrings(admins));
    fields.put("issued_by", issuedBy.toString());
    fields.put("timestamp", timestamp);
    return fields;
  }

  /** SHA-256 of the canonical encoding of {@link #getSignedFields()}. */
  public byte[] getHash() {
    return Hashes.sha256(CanonicalCbor.encode(getSignedFields()));
  }

  public String getHashHex() {
    return Hex.toStringCondensed(getHash());
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = getSignedFields();
    List<Object> encodedSignatures = new ArrayList<>();
    for (Map.Entry<DeviceAddress, byte[]> entry : signatures.entrySet()) {
      Map<String, Object> signature = new LinkedHashMap<>();
      signature.put("signer", entry.getKey().toString());
      signature.put("signature", entry.getValue());
      encodedSignatures.add(signature);
    }
    fields.put("signatures", encodedSignatures);
    return fields;
  }

  private static List<String> addressStrings(Collection<DeviceAddress> addresses) {
    List<String> result = new ArrayList<>(addresses.size());
    for (DeviceAddress address : addresses) {
      result.add(address.toString());
    }
    return result;
  }

  /** Returns a copy carrying an additional (or replaced) signature. */
  public EpochAuthenticityRecord withSignature(DeviceAddress signer, byte[] signature) {
    Map<DeviceAddress, byte[]> updated = new TreeMap<>(signatures);
    updated.put(signer, signature);
    return new EpochAuthenticityRecord(
        groupId, epoch, previousHash, members, admins, issuedBy, timestamp, updated);
  }

  public boolean hasSameBody(EpochAuthenticityRecord other) {
    return Arrays.equals(getHash(), other.getHash());
  }

  public String getGroupId() {
    return groupId;
  }

  public long getEpoch() {
    return epoch;
  }

  public byte[] getPreviousHash() {
    return previousHash.clone();
  }

  public SortedSet<DeviceAddress> getMembers() {
    return members;
  }

  public SortedSet<DeviceAddress> getAdmins() {
    return admins;
  }

  public DeviceAddress getIssuedBy() {
    return issuedBy;
  }

  public long getTimestamp() {
    return timestamp;
  }

  /** Signatures keyed by signer, in signer order. Values are shared; do not modify them. */
  public Map<DeviceAddress, byte[]> getSignatures() {
    return signatures;
  }
}
