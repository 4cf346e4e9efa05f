//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state.impl;

import java.util.HashMap;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.state.RatchetState;
import org.foxwhisper.protocol.state.SessionStore;

public class InMemorySessionStore implements SessionStore {

  private final Map<DeviceAddress, byte[]> sessions = new HashMap<>();

  @Override
  public synchronized RatchetState loadSession(DeviceAddress remoteAddress) {
    try {
      byte[] serialized = sessions.get(remoteAddress);
      return serialized == null ? null : new RatchetState(serialized);
    } catch (InvalidMessageException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized void storeSession(DeviceAddress remoteAddress, RatchetState state) {
    sessions.put(remoteAddress, state.serialize());
  }

  @Override
  public synchronized boolean containsSession(DeviceAddress remoteAddress) {
    return sessions.containsKey(remoteAddress);
  }

  @Override
  public synchronized void deleteSession(DeviceAddress remoteAddress) {
    sessions.remove(remoteAddress);
  }
}
