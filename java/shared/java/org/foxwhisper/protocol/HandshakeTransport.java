//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.util.concurrent.CompletableFuture;
import org.foxwhisper.protocol.message.HandshakeInitMessage;
import org.foxwhisper.protocol.message.HandshakeResponseMessage;

/** Delivers a handshake init to its recipient and yields the recipient's response. */
public interface HandshakeTransport {
  public CompletableFuture<HandshakeResponseMessage> exchange(HandshakeInitMessage init);
}
