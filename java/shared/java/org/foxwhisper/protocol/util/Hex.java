//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.util;

import java.io.IOException;

/** Utility for bytes to hex and hex to bytes. */
public final class Hex {

  private static final char[] HEX_DIGITS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  private Hex() {}

  public static String toStringCondensed(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte aByte : bytes) {
      builder.append(HEX_DIGITS[(aByte >> 4) & 0xf]);
      builder.append(HEX_DIGITS[aByte & 0xf]);
    }
    return builder.toString();
  }

  public static byte[] fromStringCondensed(String encoded) throws IOException {
    final char[] data = encoded.toCharArray();
    final int len = data.length;

    if ((len & 0x01) != 0) {
      throw new IOException("Odd number of characters.");
    }

    final byte[] out = new byte[len >> 1];

    for (int i = 0, j = 0; j < len; i++) {
      int high = Character.digit(data[j++], 16);
      int low = Character.digit(data[j++], 16);
      if (high < 0 || low < 0) {
        throw new IOException("Illegal hexadecimal character at " + (j - 2));
      }
      out[i] = (byte) (((high << 4) | low) & 0xFF);
    }

    return out;
  }

  public static byte[] fromStringCondensedAssert(String encoded) {
    try {
      return fromStringCondensed(encoded);
    } catch (IOException e) {
      throw new AssertionError(e);
    }
  }
}
