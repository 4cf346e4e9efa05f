//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.logging.Log;

/**
 * Append-only registry of device records. Every change is appended to the log and publishes a
 * new {@link TrustView}; published views are never modified.
 */
public class DeviceDirectory {
  private static final String TAG = "DeviceDirectory";

  private final List<DeviceRecord> changeLog = new ArrayList<>();
  private volatile TrustView current = TrustView.empty();

  public TrustView getCurrentView() {
    return current;
  }

  /**
   * Adds a new device in the {@link DeviceStatus#REGISTERED} state.
   *
   * @throws IllegalArgumentException if the binding signature does not verify or the address is
   *     already registered
   */
  public synchronized TrustView register(DeviceRecord record) {
    if (!record.verifyBinding()) {
      throw new IllegalArgumentException("device binding signature is invalid");
    }
    if (current.getDevice(record.getAddress()) != null) {
      throw new IllegalArgumentException("device already registered: " + record.getAddress());
    }
    return append(record.withStatus(DeviceStatus.REGISTERED));
  }

  public synchronized TrustView activate(DeviceAddress address) {
    DeviceRecord record = requireKnown(address);
    if (record.getStatus() != DeviceStatus.REGISTERED) {
      throw new IllegalStateException("cannot activate device in state " + record.getStatus());
    }
    return append(record.withStatus(DeviceStatus.ACTIVE));
  }

  /** Revocation is terminal. Revoking an already revoked device is a no-op. */
  public synchronized TrustView revoke(DeviceAddress address) {
    DeviceRecord record = requireKnown(address);
    if (record.getStatus() == DeviceStatus.REVOKED) {
      return current;
    }
    Log.w(TAG, "revoking device " + address);
    return append(record.withStatus(DeviceStatus.REVOKED));
  }

  public synchronized List<DeviceRecord> getChangeLog() {
    return new ArrayList<>(changeLog);
  }

  private DeviceRecord requireKnown(DeviceAddress address) {
    DeviceRecord record = current.getDevice(address);
    if (record == null) {
      throw new IllegalArgumentException("unknown device: " + address);
    }
    return record;
  }

  private TrustView append(DeviceRecord record) {
    changeLog.add(record);
    Map<DeviceAddress, DeviceRecord> devices = new HashMap<>();
    for (DeviceRecord existing : changeLog) {
      devices.put(existing.getAddress(), existing);
    }
    current = new TrustView(current.getVersion() + 1, devices);
    return current;
  }
}
