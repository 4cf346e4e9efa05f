//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/**
 * An epoch record or group message was rejected. Group state is left untouched and can be
 * recovered by resynchronizing or reconciling.
 */
public class EpochIntegrityException extends ProtocolException {
  public EpochIntegrityException(ErrorCode code, String message) {
    super(code, message);
  }
}
