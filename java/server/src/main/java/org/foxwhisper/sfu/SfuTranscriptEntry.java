//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.Collections;
import java.util.List;

/**
 * One routing decision, kept for third-party audit. Entries hold identifiers and the digest of the
 * canonical frame header, never payloads or keys.
 */
public final class SfuTranscriptEntry {

  public enum Action {
    ROUTED,
    DENIED
  }

  private final long timestamp;
  private final String callId;
  private final String participantId;
  private final String trackId;
  private final long mediaEpoch;
  private final long frameSequence;
  private final Action action;
  private final SfuErrorCode reason;
  private final List<String> subscriberIds;
  private final String headerDigest;

  SfuTranscriptEntry(
      long timestamp,
      String callId,
      String participantId,
      String trackId,
      long mediaEpoch,
      long frameSequence,
      Action action,
      SfuErrorCode reason,
      List<String> subscriberIds,
      String headerDigest) {
    this.timestamp = timestamp;
    this.callId = callId;
    this.participantId = participantId;
    this.trackId = trackId;
    this.mediaEpoch = mediaEpoch;
    this.frameSequence = frameSequence;
    this.action = action;
    this.reason = reason;
    this.subscriberIds = Collections.unmodifiableList(subscriberIds);
    this.headerDigest = headerDigest;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public String getCallId() {
    return callId;
  }

  public String getParticipantId() {
    return participantId;
  }

  public String getTrackId() {
    return trackId;
  }

  public long getMediaEpoch() {
    return mediaEpoch;
  }

  public long getFrameSequence() {
    return frameSequence;
  }

  public Action getAction() {
    return action;
  }

  /** The denial reason, or {@code null} for routed frames. */
  public SfuErrorCode getReason() {
    return reason;
  }

  public List<String> getSubscriberIds() {
    return subscriberIds;
  }

  /** Lowercase hex SHA-256 of the canonical frame header. */
  public String getHeaderDigest() {
    return headerDigest;
  }

  @Override
  public String toString() {
    return action
        + (reason == null ? "" : "(" + reason + ")")
        + " "
        + callId
        + "/"
        + participantId
        + "/"
        + trackId
        + "#"
        + frameSequence
        + " "
        + headerDigest;
  }
}
