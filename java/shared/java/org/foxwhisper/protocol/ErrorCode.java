//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/**
 * Stable codes carried by every {@link ProtocolException}. The names are part of the wire-visible
 * contract with logs and peers and must not be renamed.
 */
public enum ErrorCode {
  // Transcript and authentication.
  INVALID_SIGNATURE,
  VERSION_MISMATCH,
  UNSUPPORTED_ALGORITHM,
  REVOKED_DEVICE,
  UNKNOWN_DEVICE,
  STALE_TRANSCRIPT,
  TRANSCRIPT_MISMATCH,
  INVALID_KEY,

  // Ratchet integrity, fatal to the session.
  BACKWARD_INDEX,
  DH_REPLAY,
  GAP_OVERFLOW,
  CACHE_OVERFLOW,

  // Epoch integrity, fatal to the record or message only.
  HASH_CHAIN_BREAK,
  MISSING_ADMIN_SIGNATURE,
  INVALID_ADMIN_SIGNATURE,
  NOT_AN_ADMIN,
  MEMBERSHIP_MISMATCH,
  STALE_EPOCH_REF,
  STALE_EPOCH,
  UNKNOWN_EPOCH,
  UNKNOWN_GROUP,
  NOT_A_MEMBER,
  SENDER_KEY_POISONING,
  EPOCH_FORK_DETECTED,
  TRUNCATED_EARE,

  // Message handling.
  DUPLICATE_MESSAGE,
  DECODE_FAILED,
  DECRYPTION_FAILED,
  NO_SESSION,
  TIMEOUT,
}
