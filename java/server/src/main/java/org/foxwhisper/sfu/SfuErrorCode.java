//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

/** Stable reasons for denying an SFU request. Denials are expected traffic, not failures. */
public enum SfuErrorCode {
  UNAUTHORIZED_SUBSCRIBE,
  IMPERSONATION,
  KEY_LEAK_ATTEMPT,
  STALE_KEY_REUSE,
  DUPLICATE_ROUTE,
  REPLAY_TRACK,
  HIJACKED_TRACK,
  SIMULCAST_SPOOF,
  BITRATE_ABUSE,
  NOT_AUTHENTICATED,
  NOT_JOINED,
  TRACK_LIMIT,
  SUBSCRIBER_LIMIT
}
