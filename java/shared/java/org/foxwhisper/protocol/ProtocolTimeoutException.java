//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.time.Duration;

/** A suspending handshake or epoch transition did not complete in time. Prior state is intact. */
public class ProtocolTimeoutException extends ProtocolException {
  public ProtocolTimeoutException(String operation, Duration timeout) {
    super(ErrorCode.TIMEOUT, operation + " did not complete within " + timeout.toMillis() + "ms");
  }
}
