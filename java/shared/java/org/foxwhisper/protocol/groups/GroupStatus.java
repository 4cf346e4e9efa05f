//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

public enum GroupStatus {
  ACTIVE,
  /** Two valid records share a parent. Nothing is encrypted or decrypted until reconciled. */
  FORKED
}
