//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/** The group is halted between two conflicting epoch records until it is reconciled. */
public class EpochForkException extends EpochIntegrityException {
  private final String groupId;

  public EpochForkException(String groupId) {
    super(
        ErrorCode.EPOCH_FORK_DETECTED,
        "group " + groupId + " is forked and awaiting reconciliation");
    this.groupId = groupId;
  }

  public String getGroupId() {
    return groupId;
  }
}
