//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.ecc;

import java.security.SecureRandom;
import org.foxwhisper.protocol.InvalidKeyException;

public class Curve {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  public static ECKeyPair generateKeyPair() {
    return ECKeyPair.fromPrivateKey(ECPrivateKey.generate(SECURE_RANDOM));
  }

  public static ECPublicKey decodePoint(byte[] bytes) throws InvalidKeyException {
    return new ECPublicKey(bytes);
  }
}
