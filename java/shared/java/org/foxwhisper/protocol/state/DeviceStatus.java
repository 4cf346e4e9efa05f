//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

public enum DeviceStatus {
  REGISTERED,
  ACTIVE,
  /** Terminal. */
  REVOKED,
}
