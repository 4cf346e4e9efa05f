//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class DuplicateMessageException extends ProtocolException {
  public DuplicateMessageException(String s) {
    super(ErrorCode.DUPLICATE_MESSAGE, s);
  }
}
