//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import java.util.LinkedHashMap;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.IdentityKey;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.kem.KEMPublicKey;

/**
 * A device's published keys, bound to its identity by an identity-key signature over the
 * canonical encoding of {@link #getBindingPayload()}.
 *
 * <p>Immutable; status changes produce a new record.
 */
public final class DeviceRecord {
  private final DeviceAddress address;
  private final IdentityKey identityKey;
  private final IdentityKey signingKey;
  private final KEMPublicKey kemPublicKey;
  private final byte[] bindingSignature;
  private final DeviceStatus status;

  public DeviceRecord(
      DeviceAddress address,
      IdentityKey identityKey,
      IdentityKey signingKey,
      KEMPublicKey kemPublicKey,
      byte[] bindingSignature,
      DeviceStatus status) {
    this.address = address;
    this.identityKey = identityKey;
    this.signingKey = signingKey;
    this.kemPublicKey = kemPublicKey;
    this.bindingSignature = bindingSignature.clone();
    this.status = status;
  }

  public static byte[] bindingPayload(
      DeviceAddress address, IdentityKey signingKey, KEMPublicKey kemPublicKey) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("label", "FoxWhisper-DeviceBinding-v1");
    payload.put("identity_id", address.getName());
    payload.put("device_id", address.getDeviceId());
    payload.put("signing_key", signingKey.serialize());
    payload.put("kem_public_key", kemPublicKey.serialize());
    return CanonicalCbor.encode(payload);
  }

  public byte[] getBindingPayload() {
    return bindingPayload(address, signingKey, kemPublicKey);
  }

  public boolean verifyBinding() {
    return identityKey.verifySignature(getBindingPayload(), bindingSignature);
  }

  public DeviceRecord withStatus(DeviceStatus status) {
    return new DeviceRecord(
        address, identityKey, signingKey, kemPublicKey, bindingSignature, status);
  }

  public DeviceAddress getAddress() {
    return address;
  }

  public IdentityKey getIdentityKey() {
    return identityKey;
  }

  public IdentityKey getSigningKey() {
    return signingKey;
  }

  public KEMPublicKey getKemPublicKey() {
    return kemPublicKey;
  }

  public byte[] getBindingSignature() {
    return bindingSignature.clone();
  }

  public DeviceStatus getStatus() {
    return status;
  }

  public boolean isActive() {
    return status == DeviceStatus.ACTIVE;
  }

  @Override
  public String toString() {
    return "DeviceRecord{" + address + ", " + status + "}";
  }
}
