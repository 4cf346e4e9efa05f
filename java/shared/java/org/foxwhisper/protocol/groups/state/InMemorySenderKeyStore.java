//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups.state;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;

public class InMemorySenderKeyStore implements SenderKeyStore {

  private final Map<StoreKey, byte[]> store = new HashMap<>();

  @Override
  public synchronized void storeSenderKey(SenderKeyRecord record) {
    store.put(
        new StoreKey(record.getGroupId(), record.getEpoch(), record.getSender()),
        record.serialize());
  }

  @Override
  public synchronized SenderKeyRecord loadSenderKey(
      String groupId, long epoch, DeviceAddress sender) {
    try {
      byte[] serialized = store.get(new StoreKey(groupId, epoch, sender));
      return serialized == null ? null : new SenderKeyRecord(serialized);
    } catch (InvalidMessageException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized void deleteSenderKey(String groupId, long epoch, DeviceAddress sender) {
    store.remove(new StoreKey(groupId, epoch, sender));
  }

  @Override
  public synchronized void deleteSenderKeysBefore(String groupId, long epoch) {
    Iterator<StoreKey> keys = store.keySet().iterator();
    while (keys.hasNext()) {
      StoreKey key = keys.next();
      if (key.groupId.equals(groupId) && key.epoch < epoch) {
        keys.remove();
      }
    }
  }

  @Override
  public synchronized void deleteSenderKeysFrom(String groupId, long epoch) {
    Iterator<StoreKey> keys = store.keySet().iterator();
    while (keys.hasNext()) {
      StoreKey key = keys.next();
      if (key.groupId.equals(groupId) && key.epoch >= epoch) {
        keys.remove();
      }
    }
  }

  public synchronized int size() {
    return store.size();
  }

  private static final class StoreKey {
    private final String groupId;
    private final long epoch;
    private final DeviceAddress sender;

    StoreKey(String groupId, long epoch, DeviceAddress sender) {
      this.groupId = groupId;
      this.epoch = epoch;
      this.sender = sender;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof StoreKey)) return false;
      StoreKey that = (StoreKey) other;
      return groupId.equals(that.groupId) && epoch == that.epoch && sender.equals(that.sender);
    }

    @Override
    public int hashCode() {
      return Objects.hash(groupId, epoch, sender);
    }
  }
}
