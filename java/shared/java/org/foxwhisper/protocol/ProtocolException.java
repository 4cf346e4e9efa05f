//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/** Base class of every typed failure raised by the protocol core. */
public abstract class ProtocolException extends Exception {

  private final ErrorCode code;

  protected ProtocolException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  protected ProtocolException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode getCode() {
    return code;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
  }
}
