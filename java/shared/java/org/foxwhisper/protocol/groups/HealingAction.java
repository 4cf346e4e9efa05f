//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.Objects;
import org.foxwhisper.protocol.DeviceAddress;

/** A step the group must take after a fork has been reconciled. */
public final class HealingAction implements Comparable<HealingAction> {

  public enum Type {
    /** Every member discards sender chains from the fork epoch on and redistributes. */
    RESET_SENDER_CHAINS,
    /** The branches disagree on membership; members must refetch the full epoch history. */
    REQUEST_FULL_RESYNC,
    /** An admin signed both conflicting records and should be revoked. */
    REVOKE_MEMBER
  }

  private final Type type;
  private final DeviceAddress device;

  private HealingAction(Type type, DeviceAddress device) {
    this.type = type;
    this.device = device;
  }

  public static HealingAction resetSenderChains() {
    return new HealingAction(Type.RESET_SENDER_CHAINS, null);
  }

  public static HealingAction requestFullResync() {
    return new HealingAction(Type.REQUEST_FULL_RESYNC, null);
  }

  public static HealingAction revokeMember(DeviceAddress device) {
    return new HealingAction(Type.REVOKE_MEMBER, Objects.requireNonNull(device));
  }

  public Type getType() {
    return type;
  }

  /** The device to revoke, or {@code null} for actions that do not name one. */
  public DeviceAddress getDevice() {
    return device;
  }

  @Override
  public int compareTo(HealingAction other) {
    int byType = type.compareTo(other.type);
    if (byType != 0) {
      return byType;
    }
    if (device == null || other.device == null) {
      return device == null ? (other.device == null ? 0 : -1) : 1;
    }
    return device.compareTo(other.device);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof HealingAction)) return false;
    HealingAction that = (HealingAction) other;
    return type == that.type && Objects.equals(device, that.device);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, device);
  }

  @Override
  public String toString() {
    return device == null ? type.name() : type.name() + "(" + device + ")";
  }
}
