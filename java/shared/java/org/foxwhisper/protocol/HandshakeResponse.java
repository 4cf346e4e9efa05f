//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import org.foxwhisper.protocol.message.HandshakeResponseMessage;

/** What a responder produces: the reply to send back, and its own derived result. */
public final class HandshakeResponse {
  private final HandshakeResponseMessage message;
  private final HandshakeResult result;

  HandshakeResponse(HandshakeResponseMessage message, HandshakeResult result) {
    this.message = message;
    this.result = result;
  }

  public HandshakeResponseMessage getMessage() {
    return message;
  }

  public HandshakeResult getResult() {
    return result;
  }
}
