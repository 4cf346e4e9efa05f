//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.util.Objects;

/** Identifies one device of one identity. Ordered by name, then device id. */
public final class DeviceAddress implements Comparable<DeviceAddress> {

  public static final int MIN_DEVICE_ID = 1;
  public static final int MAX_DEVICE_ID = 127;

  private final String name;
  private final int deviceId;

  /**
   * @param name the identifier of the owning identity
   * @param deviceId the identifier for the device; must be in the range 1-127 inclusive
   */
  public DeviceAddress(String name, int deviceId) {
    if (name == null || name.isEmpty() || name.indexOf('.') >= 0) {
      throw new IllegalArgumentException("invalid identity name: " + name);
    }
    if (deviceId < MIN_DEVICE_ID || deviceId > MAX_DEVICE_ID) {
      throw new IllegalArgumentException("device id out of range: " + deviceId);
    }
    this.name = name;
    this.deviceId = deviceId;
  }

  /** Parses the {@code name.deviceId} form produced by {@link #toString()}. */
  public static DeviceAddress parse(String serialized) throws InvalidMessageException {
    int separator = serialized.lastIndexOf('.');
    if (separator <= 0) {
      throw new InvalidMessageException("malformed device address");
    }
    try {
      return new DeviceAddress(
          serialized.substring(0, separator),
          Integer.parseInt(serialized.substring(separator + 1)));
    } catch (IllegalArgumentException e) {
      throw new InvalidMessageException("malformed device address", e);
    }
  }

  public String getName() {
    return name;
  }

  public int getDeviceId() {
    return deviceId;
  }

  @Override
  public String toString() {
    return name + "." + deviceId;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof DeviceAddress)) return false;

    DeviceAddress that = (DeviceAddress) other;
    return this.name.equals(that.name) && this.deviceId == that.deviceId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, deviceId);
  }

  @Override
  public int compareTo(DeviceAddress other) {
    int byName = name.compareTo(other.name);
    return byName != 0 ? byName : Integer.compare(deviceId, other.deviceId);
  }
}
