//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

public class NoSessionException extends ProtocolException {
  private final DeviceAddress address;

  public NoSessionException(String message) {
    this(null, message);
  }

  public NoSessionException(DeviceAddress address, String message) {
    super(ErrorCode.NO_SESSION, message);
    this.address = address;
  }

  public DeviceAddress getAddress() {
    return address;
  }
}
