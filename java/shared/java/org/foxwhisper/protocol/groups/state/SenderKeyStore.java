//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups.state;

import org.foxwhisper.protocol.DeviceAddress;

public interface SenderKeyStore {

  /**
   * Commit to storage the {@link SenderKeyRecord} for its (group, epoch, sender) tuple.
   *
   * @param record the current SenderKeyRecord.
   */
  public void storeSenderKey(SenderKeyRecord record);

  /**
   * Returns a copy of the {@link SenderKeyRecord} corresponding to the (group, epoch, sender)
   * tuple, or {@code null} if one does not exist.
   *
   * <p>It is important that implementations return a copy of the current durable information. The
   * returned SenderKeyRecord may be modified, but those changes should not have an effect on the
   * durable state (what is returned by subsequent calls to this method) without the store method
   * being called here first.
   */
  public SenderKeyRecord loadSenderKey(String groupId, long epoch, DeviceAddress sender);

  public void deleteSenderKey(String groupId, long epoch, DeviceAddress sender);

  /** Removes every record of {@code groupId} whose epoch is lower than {@code epoch}. */
  public void deleteSenderKeysBefore(String groupId, long epoch);

  /** Removes every record of {@code groupId} whose epoch is {@code epoch} or higher. */
  public void deleteSenderKeysFrom(String groupId, long epoch);
}
