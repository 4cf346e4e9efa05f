//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** Counters of SFU outcomes, safe to update from any thread. */
public class SfuMetrics {
  private final Map<SfuErrorCode, LongAdder> denials = new ConcurrentHashMap<>();
  private final Map<AuthResult, LongAdder> authResults = new ConcurrentHashMap<>();
  private final LongAdder routedFrames = new LongAdder();

  void recordDenial(SfuErrorCode code) {
    denials.computeIfAbsent(code, c -> new LongAdder()).increment();
  }

  void recordAuth(AuthResult result) {
    authResults.computeIfAbsent(result, r -> new LongAdder()).increment();
  }

  void recordRoutedFrame() {
    routedFrames.increment();
  }

  public long getDenials(SfuErrorCode code) {
    LongAdder counter = denials.get(code);
    return counter == null ? 0 : counter.sum();
  }

  public long getAuthResults(AuthResult result) {
    LongAdder counter = authResults.get(result);
    return counter == null ? 0 : counter.sum();
  }

  public long getRoutedFrames() {
    return routedFrames.sum();
  }

  /** Denial counts for every code, including zeros. */
  public Map<SfuErrorCode, Long> getDenialSnapshot() {
    Map<SfuErrorCode, Long> snapshot = new EnumMap<>(SfuErrorCode.class);
    for (SfuErrorCode code : SfuErrorCode.values()) {
      snapshot.put(code, getDenials(code));
    }
    return snapshot;
  }
}
