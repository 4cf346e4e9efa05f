//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/**
 * The ratchet state for a session can no longer be trusted. The session has already been deleted
 * from the store when this is thrown; a new handshake is required.
 */
public class RatchetIntegrityException extends ProtocolException {
  private final DeviceAddress remoteAddress;

  public RatchetIntegrityException(ErrorCode code, DeviceAddress remoteAddress, String message) {
    super(code, message);
    this.remoteAddress = remoteAddress;
  }

  public DeviceAddress getRemoteAddress() {
    return remoteAddress;
  }
}
