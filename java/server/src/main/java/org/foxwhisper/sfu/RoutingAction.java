//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.Collections;
import java.util.List;

/** Where a routed frame goes. */
public final class RoutingAction {
  private final String callId;
  private final String trackId;
  private final String publisherId;
  private final List<String> recipients;
  private final String headerDigest;

  RoutingAction(
      String callId,
      String trackId,
      String publisherId,
      List<String> recipients,
      String headerDigest) {
    this.callId = callId;
    this.trackId = trackId;
    this.publisherId = publisherId;
    this.recipients = Collections.unmodifiableList(recipients);
    this.headerDigest = headerDigest;
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

  /** Subscriber ids in sorted order. */
  public List<String> getRecipients() {
    return recipients;
  }

  public String getHeaderDigest() {
    return headerDigest;
  }
}
