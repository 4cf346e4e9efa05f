//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kem;

import java.security.SecureRandom;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKeyPairGenerator;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPublicKeyParameters;

public class KEMKeyPair {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final KEMPublicKey publicKey;
  private final KEMSecretKey secretKey;

  private KEMKeyPair(KEMPublicKey publicKey, KEMSecretKey secretKey) {
    this.publicKey = publicKey;
    this.secretKey = secretKey;
  }

  public static KEMKeyPair generate(KEMKeyType keyType) {
    KyberKeyPairGenerator generator = new KyberKeyPairGenerator();
    generator.init(new KyberKeyGenerationParameters(SECURE_RANDOM, keyType.getParameters()));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    return new KEMKeyPair(
        new KEMPublicKey(keyType, (KyberPublicKeyParameters) pair.getPublic()),
        new KEMSecretKey(keyType, (KyberPrivateKeyParameters) pair.getPrivate()));
  }

  public KEMPublicKey getPublicKey() {
    return publicKey;
  }

  public KEMSecretKey getSecretKey() {
    return secretKey;
  }
}
