//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class InvalidMessageException extends ProtocolException {

  public InvalidMessageException(String detailMessage) {
    super(ErrorCode.DECODE_FAILED, detailMessage);
  }

  public InvalidMessageException(String detailMessage, Throwable throwable) {
    super(ErrorCode.DECODE_FAILED, detailMessage, throwable);
  }

  public InvalidMessageException(ErrorCode code, String detailMessage) {
    super(code, detailMessage);
  }

  public InvalidMessageException(ErrorCode code, String detailMessage, Throwable throwable) {
    super(code, detailMessage, throwable);
  }
}
