//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** A client of one call as seen by the SFU: identifiers and authorization state only. */
public final class SfuParticipant {
  private final String callId;
  private final String participantId;
  private final Set<String> publishedTracks = new TreeSet<>();
  private boolean authenticated;
  private boolean joined;

  SfuParticipant(String callId, String participantId) {
    this.callId = callId;
    this.participantId = participantId;
  }

  public String getCallId() {
    return callId;
  }

  public String getParticipantId() {
    return participantId;
  }

  public synchronized boolean isAuthenticated() {
    return authenticated;
  }

  synchronized void markAuthenticated() {
    authenticated = true;
  }

  public synchronized boolean isJoined() {
    return joined;
  }

  synchronized void markJoined() {
    joined = true;
  }

  /** A participant that left must authenticate again before rejoining. */
  synchronized void markLeft() {
    joined = false;
    authenticated = false;
  }

  public synchronized Set<String> getPublishedTracks() {
    return Collections.unmodifiableSet(new TreeSet<>(publishedTracks));
  }

  synchronized int getTrackCount() {
    return publishedTracks.size();
  }

  synchronized void addTrack(String trackId) {
    publishedTracks.add(trackId);
  }
}
