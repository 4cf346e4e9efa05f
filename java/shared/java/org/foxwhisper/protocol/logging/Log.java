//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.logging;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Static entry point used by the protocol core. Messages are dropped when no {@link
 * ProtocolLogger} has been installed.
 *
 * <p>Callers must never pass key material, plaintext, or nonces; identifiers and error codes only.
 */
public final class Log {

  private Log() {}

  public static void v(String tag, String msg) {
    log(ProtocolLogger.VERBOSE, tag, msg);
  }

  public static void d(String tag, String msg) {
    log(ProtocolLogger.DEBUG, tag, msg);
  }

  public static void i(String tag, String msg) {
    log(ProtocolLogger.INFO, tag, msg);
  }

  public static void w(String tag, String msg) {
    log(ProtocolLogger.WARN, tag, msg);
  }

  public static void w(String tag, String msg, Throwable tr) {
    log(ProtocolLogger.WARN, tag, msg + '\n' + getStackTraceString(tr));
  }

  public static void e(String tag, String msg) {
    log(ProtocolLogger.ERROR, tag, msg);
  }

  public static void e(String tag, String msg, Throwable tr) {
    log(ProtocolLogger.ERROR, tag, msg + '\n' + getStackTraceString(tr));
  }

  private static String getStackTraceString(Throwable tr) {
    if (tr == null) {
      return "";
    }

    StringWriter sw = new StringWriter();
    PrintWriter pw = new PrintWriter(sw);
    tr.printStackTrace(pw);
    pw.flush();
    return sw.toString();
  }

  private static void log(int priority, String tag, String msg) {
    ProtocolLogger logger = ProtocolLoggerProvider.getProvider();

    if (logger != null && priority >= ProtocolLoggerProvider.getMinimumLevel()) {
      logger.log(priority, tag, msg);
    }
  }
}
