//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.IdentityKey;
import org.foxwhisper.protocol.InvalidKeyException;
import org.foxwhisper.protocol.kem.KEMPublicKey;

/**
 * Access to the local device's long-term keys. Implementations may be hardware backed; private
 * key material never leaves the store.
 */
public interface DeviceKeyStore {

  public DeviceAddress getLocalAddress();

  public IdentityKey getIdentityKey();

  public IdentityKey getDeviceSigningKey();

  public KEMPublicKey getKemPublicKey();

  public byte[] signWithIdentityKey(byte[] message);

  public byte[] signWithDeviceKey(byte[] message);

  /** Recovers the shared secret for a ciphertext addressed to {@link #getKemPublicKey()}. */
  public byte[] decapsulate(byte[] ciphertext) throws InvalidKeyException;
}
