//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.Objects;

/**
 * The answer to an SFU request: either allowed, optionally with a value, or denied with a stable
 * {@link SfuErrorCode}.
 *
 * @param <T> the value carried by an allowed decision, {@link Void} when there is none
 */
public final class SfuDecision<T> {
  private final T value;
  private final SfuErrorCode errorCode;
  private final String detail;

  private SfuDecision(T value, SfuErrorCode errorCode, String detail) {
    this.value = value;
    this.errorCode = errorCode;
    this.detail = detail;
  }

  public static <T> SfuDecision<T> allow(T value) {
    return new SfuDecision<>(value, null, null);
  }

  public static SfuDecision<Void> allow() {
    return new SfuDecision<>(null, null, null);
  }

  public static <T> SfuDecision<T> deny(SfuErrorCode errorCode, String detail) {
    return new SfuDecision<>(null, Objects.requireNonNull(errorCode), detail);
  }

  public boolean isAllowed() {
    return errorCode == null;
  }

  /** The value of an allowed decision. */
  public T getValue() {
    if (!isAllowed()) {
      throw new IllegalStateException("denied: " + errorCode);
    }
    return value;
  }

  /** The denial reason, or {@code null} if the request was allowed. */
  public SfuErrorCode getErrorCode() {
    return errorCode;
  }

  public String getDetail() {
    return detail;
  }

  @Override
  public String toString() {
    return isAllowed() ? "allowed" : "denied(" + errorCode + ": " + detail + ")";
  }
}
