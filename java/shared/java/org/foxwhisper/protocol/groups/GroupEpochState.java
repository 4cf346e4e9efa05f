//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.SortedSet;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;
import org.foxwhisper.protocol.util.Hex;

/** One validated epoch of a group. Instances are immutable and superseded, never modified. */
public final class GroupEpochState {
  private final EpochAuthenticityRecord record;
  private final byte[] hash;
  private final String hashHex;

  public GroupEpochState(EpochAuthenticityRecord record) {
    this.record = record;
    this.hash = record.getHash();
    this.hashHex = record.getHashHex();
  }

  public String getGroupId() {
    return record.getGroupId();
  }

  public long getEpoch() {
    return record.getEpoch();
  }

  /** Position in the hash chain. Every record extends its parent by one, so this is the epoch. */
  public long getDepth() {
    return record.getEpoch();
  }

  public SortedSet<DeviceAddress> getMembers() {
    return record.getMembers();
  }

  public SortedSet<DeviceAddress> getAdmins() {
    return record.getAdmins();
  }

  public boolean isMember(DeviceAddress address) {
    return record.getMembers().contains(address);
  }

  public boolean isAdmin(DeviceAddress address) {
    return record.getAdmins().contains(address);
  }

  public EpochAuthenticityRecord getRecord() {
    return record;
  }

  public byte[] getHash() {
    return hash.clone();
  }

  public String getHashHex() {
    return hashHex;
  }

  public String getPreviousHashHex() {
    return Hex.toStringCondensed(record.getPreviousHash());
  }

  @Override
  public String toString() {
    return record.getGroupId() + "@" + record.getEpoch() + ":" + hashHex.substring(0, 16);
  }
}
