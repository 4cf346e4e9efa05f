//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A published media track. Each track id belongs to exactly one publisher for as long as the
 * publisher stays in the call.
 */
public final class SfuTrack {
  private final String callId;
  private final String trackId;
  private final String publisherId;
  private final SortedSet<String> layers;
  /** Subscriber id to requested layer, {@code null} meaning every layer. */
  private final Map<String, String> subscribers = new TreeMap<>();
  private long lastFrameSequence = -1;

  SfuTrack(String callId, String trackId, String publisherId, Collection<String> layers) {
    this.callId = callId;
    this.trackId = trackId;
    this.publisherId = publisherId;
    this.layers =
        layers == null
            ? Collections.<String>emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(layers));
  }

  public String getCallId() {
    return callId;
  }

  public String getTrackId() {
    return trackId;
  }

  public String getPublisherId() {
    return publisherId;
  }

  /** The advertised simulcast layers. Empty for single-layer tracks. */
  public SortedSet<String> getLayers() {
    return layers;
  }

  public synchronized SortedSet<String> getSubscribers() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(subscribers.keySet()));
  }

  synchronized boolean addSubscriber(String subscriberId, String layer, int maxSubscribers) {
    if (!subscribers.containsKey(subscriberId) && subscribers.size() >= maxSubscribers) {
      return false;
    }
    subscribers.put(subscriberId, layer);
    return true;
  }

  synchronized boolean removeSubscriber(String subscriberId) {
    return subscribers.remove(subscriberId) != null;
  }

  /** Accepts {@code sequence} if it is newer than every sequence seen so far. */
  synchronized boolean advanceSequence(long sequence) {
    if (sequence <= lastFrameSequence) {
      return false;
    }
    lastFrameSequence = sequence;
    return true;
  }

  /** Subscribers that asked for {@code layer}, or for every layer. */
  synchronized List<String> recipientsFor(String layer) {
    List<String> recipients = new ArrayList<>();
    for (Map.Entry<String, String> subscriber : subscribers.entrySet()) {
      if (subscriber.getValue() == null || subscriber.getValue().equals(layer)) {
        recipients.add(subscriber.getKey());
      }
    }
    return recipients;
  }
}
