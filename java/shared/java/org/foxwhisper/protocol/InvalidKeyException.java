//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class InvalidKeyException extends ProtocolException {

  public InvalidKeyException(String detailMessage) {
    super(ErrorCode.INVALID_KEY, detailMessage);
  }

  public InvalidKeyException(String detailMessage, Throwable throwable) {
    super(ErrorCode.INVALID_KEY, detailMessage, throwable);
  }
}
