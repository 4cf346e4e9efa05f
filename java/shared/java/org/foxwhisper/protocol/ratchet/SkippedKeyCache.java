//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ratchet;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-capacity store of message keys derived ahead of their messages. Keys leave the cache when
 * they are consumed; the cache never grows past its capacity, and callers must check {@link
 * #hasRoomFor(int)} before deriving keys to insert.
 *
 * @param <K> the lookup key, for example (ratchet key, index) or a plain index
 */
public class SkippedKeyCache<K> {
  private final int capacity;
  private final LinkedHashMap<K, byte[]> entries = new LinkedHashMap<>();

  public SkippedKeyCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }

  public int size() {
    return entries.size();
  }

  public boolean hasRoomFor(int additional) {
    return entries.size() + additional <= capacity;
  }

  public void put(K key, byte[] messageKey) {
    if (!entries.containsKey(key) && entries.size() >= capacity) {
      throw new IllegalStateException("skipped key cache is full");
    }
    entries.put(key, messageKey.clone());
  }

  /** Removes and returns the key, or {@code null} if it was never cached or already used. */
  public byte[] remove(K key) {
    return entries.remove(key);
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  /** Entries in insertion order, for serialization. */
  public List<Map.Entry<K, byte[]>> entries() {
    List<Map.Entry<K, byte[]>> result = new ArrayList<>(entries.size());
    for (Map.Entry<K, byte[]> entry : entries.entrySet()) {
      result.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue().clone()));
    }
    return result;
  }
}
