//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.kdf;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/** HKDF-SHA256 (RFC 5869). */
public abstract class HKDF {
  public static byte[] deriveSecrets(byte[] inputKeyMaterial, byte[] info, int outputLength) {
    return deriveSecrets(inputKeyMaterial, null, info, outputLength);
  }

  public static byte[] deriveSecrets(
      byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength) {
    if (outputLength <= 0 || outputLength > 255 * 32) {
      throw new IllegalArgumentException("invalid output length: " + outputLength);
    }

    HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(new HKDFParameters(inputKeyMaterial, salt, info));

    byte[] output = new byte[outputLength];
    generator.generateBytes(output, 0, outputLength);
    return output;
  }
}
