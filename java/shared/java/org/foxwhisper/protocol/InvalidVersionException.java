//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class InvalidVersionException extends TranscriptException {
  public InvalidVersionException(String message) {
    super(ErrorCode.VERSION_MISMATCH, message);
  }

  public InvalidVersionException(ErrorCode code, String message) {
    super(code, message);
  }
}
