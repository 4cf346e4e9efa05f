//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

public enum AuthResult {
  ACCEPTED,
  /** No key is registered for the client, or the MAC does not verify. */
  IMPERSONATION,
  /** The token timestamp is outside the allowed clock skew. */
  TOKEN_EXPIRED,
  /** The nonce has been seen before. */
  REPLAY
}
