//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state.impl;

import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.IdentityKey;
import org.foxwhisper.protocol.IdentityKeyPair;
import org.foxwhisper.protocol.InvalidKeyException;
import org.foxwhisper.protocol.kem.KEMKeyPair;
import org.foxwhisper.protocol.kem.KEMKeyType;
import org.foxwhisper.protocol.kem.KEMPublicKey;
import org.foxwhisper.protocol.state.DeviceKeyStore;
import org.foxwhisper.protocol.state.DeviceRecord;
import org.foxwhisper.protocol.state.DeviceStatus;

public class InMemoryDeviceKeyStore implements DeviceKeyStore {

  private final DeviceAddress address;
  private final IdentityKeyPair identityKeyPair;
  private final IdentityKeyPair deviceKeyPair;
  private final KEMKeyPair kemKeyPair;

  public InMemoryDeviceKeyStore(
      DeviceAddress address,
      IdentityKeyPair identityKeyPair,
      IdentityKeyPair deviceKeyPair,
      KEMKeyPair kemKeyPair) {
    this.address = address;
    this.identityKeyPair = identityKeyPair;
    this.deviceKeyPair = deviceKeyPair;
    this.kemKeyPair = kemKeyPair;
  }

  /** Creates a store with fresh device keys under an existing identity. */
  public static InMemoryDeviceKeyStore generate(
      DeviceAddress address, IdentityKeyPair identityKeyPair) {
    return new InMemoryDeviceKeyStore(
        address,
        identityKeyPair,
        IdentityKeyPair.generate(),
        KEMKeyPair.generate(KEMKeyType.KYBER_1024));
  }

  /** Builds the record to publish for this device, signed by the identity key. */
  public DeviceRecord createDeviceRecord() {
    byte[] payload =
        DeviceRecord.bindingPayload(
            address, deviceKeyPair.getPublicKey(), kemKeyPair.getPublicKey());
    return new DeviceRecord(
        address,
        identityKeyPair.getPublicKey(),
        deviceKeyPair.getPublicKey(),
        kemKeyPair.getPublicKey(),
        identityKeyPair.signMessage(payload),
        DeviceStatus.REGISTERED);
  }

  @Override
  public DeviceAddress getLocalAddress() {
    return address;
  }

  @Override
  public IdentityKey getIdentityKey() {
    return identityKeyPair.getPublicKey();
  }

  @Override
  public IdentityKey getDeviceSigningKey() {
    return deviceKeyPair.getPublicKey();
  }

  @Override
  public KEMPublicKey getKemPublicKey() {
    return kemKeyPair.getPublicKey();
  }

  @Override
  public byte[] signWithIdentityKey(byte[] message) {
    return identityKeyPair.signMessage(message);
  }

  @Override
  public byte[] signWithDeviceKey(byte[] message) {
    return deviceKeyPair.signMessage(message);
  }

  @Override
  public byte[] decapsulate(byte[] ciphertext) throws InvalidKeyException {
    return kemKeyPair.getSecretKey().decapsulate(ciphertext);
  }
}
