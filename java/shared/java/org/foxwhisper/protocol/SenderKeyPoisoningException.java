//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

/** A second, different chain root was distributed for an already known (group, epoch, sender). */
public class SenderKeyPoisoningException extends EpochIntegrityException {
  private final DeviceAddress sender;

  public SenderKeyPoisoningException(DeviceAddress sender, String message) {
    super(ErrorCode.SENDER_KEY_POISONING, message);
    this.sender = sender;
  }

  public DeviceAddress getSender() {
    return sender;
  }
}
