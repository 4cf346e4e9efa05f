//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import org.foxwhisper.protocol.DeviceAddress;

/**
 * The interface to the durable store of pairwise ratchet state.
 *
 * <p>The local device is implied; sessions are keyed by the remote device.
 */
public interface SessionStore {

  /**
   * Returns a copy of the {@link RatchetState} for the given remote device, or {@code null} if
   * there is none.
   *
   * <p>It is important that implementations return a copy of the current durable information. The
   * returned state may be modified, but those changes must not have an effect on the durable
   * session state (what is returned by subsequent calls to this method) without the store method
   * being called here first.
   */
  public RatchetState loadSession(DeviceAddress remoteAddress);

  /** Commits to storage the ratchet state for the given remote device. */
  public void storeSession(DeviceAddress remoteAddress, RatchetState state);

  public boolean containsSession(DeviceAddress remoteAddress);

  /** Removes the session for the given remote device, if any. */
  public void deleteSession(DeviceAddress remoteAddress);
}
