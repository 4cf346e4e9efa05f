//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * Remembers the most recent authentication nonces. When full, the oldest nonce is evicted first,
 * so the cache never holds more than its capacity.
 */
public class NonceCache {
  private final int capacity;
  private final ArrayDeque<String> order = new ArrayDeque<>();
  private final Set<String> seen = new HashSet<>();

  public NonceCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  /** Records {@code key}. Returns {@code false} if it is already present. */
  public synchronized boolean add(String key) {
    if (seen.contains(key)) {
      return false;
    }
    if (order.size() == capacity) {
      seen.remove(order.removeFirst());
    }
    order.addLast(key);
    seen.add(key);
    return true;
  }

  public synchronized boolean contains(String key) {
    return seen.contains(key);
  }

  public synchronized int size() {
    return order.size();
  }

  public int capacity() {
    return capacity;
  }
}
