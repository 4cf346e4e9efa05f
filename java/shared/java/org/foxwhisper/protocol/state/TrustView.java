//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.RevokedDeviceException;
import org.foxwhisper.protocol.TranscriptException;

/**
 * An immutable snapshot of every known device record at one directory version. Decisions are made
 * against a snapshot taken at decision time; holders compare {@link #getVersion()} to detect that
 * a newer view exists.
 */
public final class TrustView {
  private final long version;
  private final Map<DeviceAddress, DeviceRecord> devices;

  TrustView(long version, Map<DeviceAddress, DeviceRecord> devices) {
    this.version = version;
    this.devices = Collections.unmodifiableMap(new TreeMap<>(devices));
  }

  static TrustView empty() {
    return new TrustView(0, Collections.emptyMap());
  }

  public long getVersion() {
    return version;
  }

  /** Returns the record for {@code address}, or {@code null} if none was ever registered. */
  public DeviceRecord getDevice(DeviceAddress address) {
    return devices.get(address);
  }

  public boolean isActive(DeviceAddress address) {
    DeviceRecord record = devices.get(address);
    return record != null && record.isActive();
  }

  public boolean isRevoked(DeviceAddress address) {
    DeviceRecord record = devices.get(address);
    return record != null && record.getStatus() == DeviceStatus.REVOKED;
  }

  /**
   * @throws RevokedDeviceException if the device has been revoked
   * @throws TranscriptException if the device is unknown or not yet active
   */
  public DeviceRecord requireActive(DeviceAddress address) throws TranscriptException {
    DeviceRecord record = devices.get(address);
    if (record == null) {
      throw new TranscriptException(ErrorCode.UNKNOWN_DEVICE, "unknown device " + address);
    }
    if (record.getStatus() == DeviceStatus.REVOKED) {
      throw new RevokedDeviceException(address);
    }
    if (record.getStatus() != DeviceStatus.ACTIVE) {
      throw new TranscriptException(ErrorCode.UNKNOWN_DEVICE, "device " + address + " not active");
    }
    return record;
  }

  public List<DeviceRecord> getDevices(String identityName) {
    List<DeviceRecord> result = new ArrayList<>();
    for (DeviceRecord record : devices.values()) {
      if (record.getAddress().getName().equals(identityName)) {
        result.add(record);
      }
    }
    return result;
  }
}
