//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.logging;

public class ProtocolLoggerProvider {

  private static volatile ProtocolLogger provider;
  private static volatile int minimumLevel = ProtocolLogger.INFO;

  /**
   * Sets the least severe level that will be forwarded to the provider.
   *
   * @param level One of the constants from {@link ProtocolLogger}.
   */
  public static void setMinimumLevel(int level) {
    if (level < ProtocolLogger.VERBOSE || level > ProtocolLogger.ASSERT) {
      throw new IllegalArgumentException("invalid log level");
    }
    minimumLevel = level;
  }

  public static int getMinimumLevel() {
    return minimumLevel;
  }

  public static ProtocolLogger getProvider() {
    return provider;
  }

  public static void setProvider(ProtocolLogger provider) {
    ProtocolLoggerProvider.provider = provider;
  }
}
