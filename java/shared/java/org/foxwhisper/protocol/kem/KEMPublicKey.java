//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kem;

import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKEMGenerator;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPublicKeyParameters;
import org.foxwhisper.protocol.InvalidKeyException;

public class KEMPublicKey {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final KEMKeyType keyType;
  private final byte[] serialized;

  public KEMPublicKey(KEMKeyType keyType, byte[] serialized) throws InvalidKeyException {
    if (serialized == null || serialized.length != keyType.getPublicKeyLength()) {
      throw new InvalidKeyException("invalid " + keyType + " public key length");
    }
    this.keyType = keyType;
    this.serialized = serialized.clone();
  }

  KEMPublicKey(KEMKeyType keyType, KyberPublicKeyParameters parameters) {
    this.keyType = keyType;
    this.serialized = parameters.getEncoded();
  }

  public KEMKeyType getKeyType() {
    return keyType;
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  public KEMEncapsulation encapsulate() {
    KyberKEMGenerator generator = new KyberKEMGenerator(SECURE_RANDOM);
    SecretWithEncapsulation result =
        generator.generateEncapsulated(
            new KyberPublicKeyParameters(keyType.getParameters(), serialized));
    return new KEMEncapsulation(result.getSecret(), result.getEncapsulation());
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof KEMPublicKey)) return false;
    KEMPublicKey that = (KEMPublicKey) other;
    return keyType == that.keyType && Arrays.equals(serialized, that.serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
