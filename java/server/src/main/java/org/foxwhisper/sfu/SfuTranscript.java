//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/** Bounded, append-only log of routing decisions. The oldest entries are dropped when full. */
public class SfuTranscript {
  private final int capacity;
  private final ArrayDeque<SfuTranscriptEntry> entries = new ArrayDeque<>();
  private long dropped;

  public SfuTranscript(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  synchronized void append(SfuTranscriptEntry entry) {
    if (entries.size() == capacity) {
      entries.removeFirst();
      dropped++;
    }
    entries.addLast(entry);
  }

  public synchronized List<SfuTranscriptEntry> getEntries() {
    return new ArrayList<>(entries);
  }

  public synchronized int size() {
    return entries.size();
  }

  /** Number of entries evicted because the transcript was full. */
  public synchronized long getDroppedCount() {
    return dropped;
  }
}
