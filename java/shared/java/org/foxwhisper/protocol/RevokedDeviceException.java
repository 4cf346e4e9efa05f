//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class RevokedDeviceException extends TranscriptException {
  private final DeviceAddress device;

  public RevokedDeviceException(DeviceAddress device) {
    super(ErrorCode.REVOKED_DEVICE, "device " + device + " has been revoked");
    this.device = device;
  }

  public DeviceAddress getDevice() {
    return device;
  }
}
