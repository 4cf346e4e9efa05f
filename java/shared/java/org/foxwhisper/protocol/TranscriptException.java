//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/**
 * A handshake or authentication failure. The operation is rejected and no session is created;
 * callers must never retry with weaker parameters.
 */
public class TranscriptException extends ProtocolException {
  public TranscriptException(ErrorCode code, String message) {
    super(code, message);
  }

  public TranscriptException(ErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
