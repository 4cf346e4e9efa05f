//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.time.Instant;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.message.HandshakeInitMessage;

/**
 * Initiator-side state between sending a {@link HandshakeInitMessage} and receiving the response.
 * Single use: it can be completed at most once.
 */
public final class PendingHandshake {
  private final HandshakeInitMessage initMessage;
  private final ECKeyPair ephemeralKeyPair;
  private final Instant createdAt;
  private boolean completed;

  PendingHandshake(
      HandshakeInitMessage initMessage, ECKeyPair ephemeralKeyPair, Instant createdAt) {
    this.initMessage = initMessage;
    this.ephemeralKeyPair = ephemeralKeyPair;
    this.createdAt = createdAt;
  }

  public HandshakeInitMessage getInitMessage() {
    return initMessage;
  }

  public DeviceAddress getRemoteAddress() {
    return initMessage.getRecipient();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  ECKeyPair getEphemeralKeyPair() {
    return ephemeralKeyPair;
  }

  synchronized boolean markCompleted() {
    if (completed) {
      return false;
    }
    completed = true;
    return true;
  }
}
